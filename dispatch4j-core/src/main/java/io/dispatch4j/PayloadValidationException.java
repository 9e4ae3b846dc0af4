package io.dispatch4j;

import io.dispatch4j.core.JobType;
import io.dispatch4j.payload.FieldIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The payload does not match the schema of its job type. Carries every offending
 * field, not just the first one. Never retried.
 */
public class PayloadValidationException extends DispatchException {

    private final JobType jobType;
    private final List<FieldIssue> issues;

    public PayloadValidationException(JobType jobType, List<FieldIssue> issues) {
        super("Invalid payload for job type " + jobType + ": " + summarize(issues));
        this.jobType = jobType;
        this.issues = List.copyOf(issues);
    }

    public JobType jobType() {
        return jobType;
    }

    public List<FieldIssue> issues() {
        return issues;
    }

    private static String summarize(List<FieldIssue> issues) {
        return issues.stream()
                .map(i -> i.path() + " " + i.message())
                .collect(Collectors.joining(", "));
    }
}
