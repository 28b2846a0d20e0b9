package com.example.studyplanner.planner;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes a busy interval from a list of free segments. The output is correct but not minimal:
 * pieces are neither merged nor de-duplicated.
 */
public final class IntervalSubtractor {

    private IntervalSubtractor() {
    }

    public static List<TimeInterval> subtract(List<TimeInterval> segments, TimeInterval busy) {
        List<TimeInterval> result = new ArrayList<>(segments.size() + 1);
        for (TimeInterval segment : segments) {
            if (!busy.overlaps(segment)) {
                result.add(segment);
                continue;
            }
            // head survives when busy starts inside the segment, tail when it ends inside
            addIfPositive(result, TimeInterval.ofPositive(segment.start(), busy.start()));
            addIfPositive(result, TimeInterval.ofPositive(busy.end(), segment.end()));
        }
        return result;
    }

    private static void addIfPositive(List<TimeInterval> target, TimeInterval piece) {
        if (piece != null) {
            target.add(piece);
        }
    }
}
