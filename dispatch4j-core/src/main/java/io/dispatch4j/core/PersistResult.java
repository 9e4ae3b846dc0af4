package io.dispatch4j.core;

/**
 * Outcome of a job create: {@code created} is false when a record with the same
 * dedup key already existed and was returned instead.
 */
public record PersistResult(
        JobRecord job,
        boolean created
) {
    public static PersistResult createdResult(JobRecord job) {
        return new PersistResult(job, true);
    }

    public static PersistResult existingResult(JobRecord job) {
        return new PersistResult(job, false);
    }
}
