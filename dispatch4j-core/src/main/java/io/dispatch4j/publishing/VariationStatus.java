package io.dispatch4j.publishing;

public enum VariationStatus {
    PENDING,
    APPROVED,
    SCHEDULED,
    PUBLISHING,
    PUBLISHED,
    FAILED
}
