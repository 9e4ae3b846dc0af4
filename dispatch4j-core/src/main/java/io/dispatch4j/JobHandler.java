package io.dispatch4j;

import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobType;
import io.dispatch4j.payload.JobPayload;

/**
 * Executes jobs of one {@link JobType}. The returned value is converted to a map and
 * stored as the job result; null is allowed.
 *
 * <p>Throw {@link NonRetryableJobException} to fail the job without further attempts.
 */
public interface JobHandler<P extends JobPayload> {
    JobType type();

    Class<P> payloadClass();

    Object execute(JobRecord job, P payload) throws Exception;
}
