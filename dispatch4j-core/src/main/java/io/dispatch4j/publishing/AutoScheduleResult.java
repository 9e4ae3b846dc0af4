package io.dispatch4j.publishing;

import java.time.Instant;
import java.util.List;

/**
 * @param assignments content ids with the slot they were given, in slot order
 * @param unscheduled ids left without a slot
 */
public record AutoScheduleResult(List<SlotAssignment> assignments, List<String> unscheduled) {

    public AutoScheduleResult {
        assignments = List.copyOf(assignments);
        unscheduled = List.copyOf(unscheduled);
    }

    public int scheduled() {
        return assignments.size();
    }

    public record SlotAssignment(String contentId, Instant slot) {
    }
}
