package io.dispatch4j;

import io.dispatch4j.core.JobStatus;

/**
 * The requested operation is not allowed from the job's current status.
 */
public class InvalidJobStateException extends DispatchException {

    private final String jobId;
    private final JobStatus status;

    public InvalidJobStateException(String jobId, JobStatus status, String operation) {
        super("Cannot " + operation + " job " + jobId + " in " + status + " state");
        this.jobId = jobId;
        this.status = status;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }
}
