package com.example.studyplanner.common;

import java.util.Collections;
import java.util.Map;

/**
 * API共通のレスポンス形式。
 * <p>
 * クライアントは {@code success} と {@code data} を見て処理するため、
 * プランナーAPIとヘルスチェックはすべてこの形で返す。件数などの補足は {@code meta} に入れる。
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
