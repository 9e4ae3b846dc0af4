package io.dispatch4j.core;

/**
 * Dispatch priority. Among entries that are ready at the same time, a higher
 * {@link #value()} is claimed first.
 */
public enum Priority {

    HIGH(10),
    NORMAL(0),
    LOW(-10);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static Priority fromValue(int value) {
        if (value >= HIGH.value) return HIGH;
        if (value <= LOW.value) return LOW;
        return NORMAL;
    }
}
