package io.dispatch4j.publishing;

import io.dispatch4j.spi.ContentStore;
import io.dispatch4j.spi.PostingScheduleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assigns publishing slots to content over a horizon.
 *
 * <p>Slots come from the tenant's active posting schedules, or from weekday defaults
 * (09:00, 12:00, 17:00) when the tenant has none. Slots at or before {@code start} and
 * slots already taken by the brand's scheduled content are skipped.
 */
public class AutoScheduler {
    private static final Logger log = LoggerFactory.getLogger(AutoScheduler.class);

    public static final Duration DEFAULT_HORIZON = Duration.ofDays(7);
    static final List<LocalTime> DEFAULT_TIMES = List.of(LocalTime.of(9, 0), LocalTime.of(12, 0), LocalTime.of(17, 0));
    static final Set<DayOfWeek> DEFAULT_DAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    // slots reused round-robin when content is not spread across days
    private static final int CLUSTER_SIZE = 3;

    private final ContentStore contentStore;
    private final PostingScheduleProvider schedules;
    private final Duration horizon;
    private final ZoneId zone;

    public AutoScheduler(ContentStore contentStore, PostingScheduleProvider schedules) {
        this(contentStore, schedules, DEFAULT_HORIZON, ZoneId.of("UTC"));
    }

    public AutoScheduler(ContentStore contentStore, PostingScheduleProvider schedules, Duration horizon, ZoneId zone) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.schedules = Objects.requireNonNull(schedules, "schedules must not be null");
        this.horizon = Objects.requireNonNull(horizon, "horizon must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (horizon.toDays() < 1) {
            throw new IllegalArgumentException("horizon must be at least one day");
        }
    }

    public AutoScheduleResult schedule(String tenantId, String brandId, List<String> contentIds, Instant start) {
        return schedule(tenantId, brandId, contentIds, start, true);
    }

    /**
     * @param spreadAcrossDays when false the content is packed onto the first three
     *                         free slots, round-robin
     */
    public AutoScheduleResult schedule(String tenantId,
                                       String brandId,
                                       List<String> contentIds,
                                       Instant start,
                                       boolean spreadAcrossDays) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(brandId, "brandId must not be null");
        Objects.requireNonNull(contentIds, "contentIds must not be null");
        Objects.requireNonNull(start, "start must not be null");

        List<Instant> slots = freeSlots(tenantId, brandId, start);

        List<AutoScheduleResult.SlotAssignment> assignments = new ArrayList<>();
        List<String> unscheduled = new ArrayList<>();
        int used = 0;
        for (String contentId : contentIds) {
            if (used >= slots.size()) {
                unscheduled.add(contentId);
                continue;
            }
            Instant slot = spreadAcrossDays
                    ? slots.get(used)
                    : slots.get(used % Math.min(CLUSTER_SIZE, slots.size()));
            if (contentStore.assignSchedule(tenantId, contentId, slot)) {
                assignments.add(new AutoScheduleResult.SlotAssignment(contentId, slot));
                used++;
            } else {
                log.warn("auto-schedule skipped unknown content tenant={} content={}", tenantId, contentId);
                unscheduled.add(contentId);
            }
        }

        log.info("auto-schedule tenant={} brand={} requested={} scheduled={} freeSlots={}",
                tenantId, brandId, contentIds.size(), assignments.size(), slots.size());
        return new AutoScheduleResult(assignments, unscheduled);
    }

    List<Instant> freeSlots(String tenantId, String brandId, Instant start) {
        Instant end = start.plus(horizon);
        Set<Instant> occupied = new HashSet<>(contentStore.findScheduledSlots(brandId, start, end));

        List<PostingSchedule> active = schedules.activeSchedules(tenantId).stream()
                .filter(PostingSchedule::active)
                .toList();

        TreeSet<Instant> slots = new TreeSet<>();
        LocalDate firstDay = start.atZone(zone).toLocalDate();
        long days = horizon.toDays();
        for (long d = 0; d < days; d++) {
            LocalDate day = firstDay.plusDays(d);
            if (active.isEmpty()) {
                if (DEFAULT_DAYS.contains(day.getDayOfWeek())) {
                    addSlots(slots, day, DEFAULT_TIMES, start, end, occupied);
                }
                continue;
            }
            for (PostingSchedule schedule : active) {
                if (schedule.appliesTo(day.getDayOfWeek())) {
                    addSlots(slots, day, schedule.postingTimes(), start, end, occupied);
                }
            }
        }
        return new ArrayList<>(slots);
    }

    private void addSlots(Set<Instant> slots,
                          LocalDate day,
                          List<LocalTime> times,
                          Instant start,
                          Instant end,
                          Set<Instant> occupied) {
        for (LocalTime time : times) {
            Instant slot = day.atTime(time).atZone(zone).toInstant();
            if (slot.isAfter(start) && slot.isBefore(end) && !occupied.contains(slot)) {
                slots.add(slot);
            }
        }
    }
}
