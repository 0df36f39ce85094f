package com.batrun.core.error;

/**
 * Runner failure: the test driver could not execute a test case at all
 * (process launch failure, I/O failure). Distinct from a test case that ran and
 * reported failure.
 */
public class TestDriverException extends BatrunException {

    public TestDriverException(String message, Throwable cause) {
        super(message, cause);
    }

    public TestDriverException(String message) {
        super(message);
    }
}
