package io.dispatch4j.payload;

/**
 * Marker for the typed payload of one {@link io.dispatch4j.core.JobType}.
 */
public interface JobPayload {
}
