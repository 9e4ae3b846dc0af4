package io.dispatch4j;

/**
 * The tenant hit one of its job-dispatch ceilings. Nothing was written; the caller
 * should back off and resubmit later.
 */
public class QuotaExceededException extends DispatchException {

    public enum Quota {
        /** PENDING + RUNNING jobs of the tenant. */
        ACTIVE_JOBS,
        /** Jobs dispatched within the current rate-limit window. */
        DISPATCH_WINDOW
    }

    private final String tenantId;
    private final Quota quota;
    private final int current;
    private final int limit;

    public QuotaExceededException(String tenantId, Quota quota, int current, int limit) {
        super("Job quota " + quota + " exceeded for tenant " + tenantId + " (" + current + "/" + limit + ")");
        this.tenantId = tenantId;
        this.quota = quota;
        this.current = current;
        this.limit = limit;
    }

    public String tenantId() {
        return tenantId;
    }

    public Quota quota() {
        return quota;
    }

    public int current() {
        return current;
    }

    public int limit() {
        return limit;
    }
}
