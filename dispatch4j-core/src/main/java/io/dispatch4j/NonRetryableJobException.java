package io.dispatch4j;

/**
 * Thrown by a {@link JobHandler} when another attempt cannot succeed, e.g. the input
 * refers to something that no longer exists.
 */
public class NonRetryableJobException extends DispatchException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
