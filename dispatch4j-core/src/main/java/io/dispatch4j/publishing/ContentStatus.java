package io.dispatch4j.publishing;

public enum ContentStatus {
    DRAFT,
    PENDING,
    SCHEDULED,
    PUBLISHING,
    PUBLISHED,
    FAILED
}
