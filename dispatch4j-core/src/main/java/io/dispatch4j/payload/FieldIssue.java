package io.dispatch4j.payload;

/**
 * One offending payload field. {@code path} is the top-level key, or the empty string
 * when the payload as a whole is unusable.
 */
public record FieldIssue(String path, String message) {
}
