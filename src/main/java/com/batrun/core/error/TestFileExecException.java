package com.batrun.core.error;

import java.nio.file.Path;

/**
 * Thrown when a driver cannot evaluate a test file, e.g. because of a syntax error.
 */
public class TestFileExecException extends BatrunException {
    public TestFileExecException(Path file, String details) {
        super("cannot execute test file `" + file + "`", details);
    }
}
