package com.example.studyplanner.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working set of free slots for one scheduling run. Entries shrink or disappear as items are placed.
 */
final class SlotQueue {

    private final List<TimeInterval> slots;

    SlotQueue(List<TimeInterval> freeSlots) {
        this.slots = new ArrayList<>(freeSlots);
        Collections.sort(this.slots);
    }

    int size() {
        return slots.size();
    }

    TimeInterval get(int index) {
        return slots.get(index);
    }

    /**
     * Replaces the slot at {@code index} with its remainder, or drops it when nothing is left.
     */
    void shrink(int index, TimeInterval remainder) {
        if (remainder == null) {
            slots.remove(index);
        } else {
            slots.set(index, remainder);
        }
    }
}
