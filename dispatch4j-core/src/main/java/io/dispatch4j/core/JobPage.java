package io.dispatch4j.core;

import java.util.List;

/**
 * One page of a job listing, newest first. {@code nextCursor} is the last id on the
 * page when {@code hasMore} is true, otherwise null.
 */
public record JobPage(
        List<JobRecord> jobs,
        String nextCursor,
        boolean hasMore
) {
    public static JobPage empty() {
        return new JobPage(List.of(), null, false);
    }
}
