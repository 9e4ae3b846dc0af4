package io.dispatch4j.publishing;

public enum AttemptOutcome {
    SUCCESS,
    FAILED,
    RATE_LIMITED
}
