package com.batrun.core.error;

/**
 * Base class of every error raised while loading or running test suites.
 * <p>
 * {@code details} carries secondary information (the underlying cause message,
 * a driver's stderr) shown by reporters below the main message.
 */
public class BatrunException extends RuntimeException {

    private final String details;

    public BatrunException(String message) {
        this(message, null, null);
    }

    public BatrunException(String message, String details) {
        this(message, details, null);
    }

    public BatrunException(String message, Throwable cause) {
        this(message, cause != null ? cause.getMessage() : null, cause);
    }

    public BatrunException(String message, String details, Throwable cause) {
        super(message, cause);
        this.details = details;
    }

    public String getDetails() {
        return details != null ? details : "";
    }
}
