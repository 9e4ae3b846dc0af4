package io.dispatch4j;

/**
 * Base type of all errors raised by the dispatch subsystem.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
