package io.dispatch4j.spi;

import io.dispatch4j.publishing.PostingSchedule;

import java.util.List;

@FunctionalInterface
public interface PostingScheduleProvider {

    /**
     * Active posting schedules of the tenant; empty when none is configured.
     */
    List<PostingSchedule> activeSchedules(String tenantId);
}
