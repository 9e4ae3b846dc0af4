package io.dispatch4j.publishing;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Days and times of day a tenant wants content published.
 */
public record PostingSchedule(
        String tenantId,
        Set<DayOfWeek> activeDays,
        List<LocalTime> postingTimes,
        boolean active
) {
    public PostingSchedule {
        activeDays = (activeDays == null || activeDays.isEmpty())
                ? Set.of() : Set.copyOf(EnumSet.copyOf(activeDays));
        postingTimes = postingTimes == null ? List.of() : List.copyOf(postingTimes);
    }

    public boolean appliesTo(DayOfWeek day) {
        return active && activeDays.contains(day);
    }
}
