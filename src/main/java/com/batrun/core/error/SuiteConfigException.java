package com.batrun.core.error;

import java.nio.file.Path;

/**
 * Thrown when a test suite config file cannot be read or is not valid.
 */
public class SuiteConfigException extends BatrunException {

    private final Path filename;

    public SuiteConfigException(String message, Path filename, Throwable cause) {
        super(message + " `" + filename + "`", cause);
        this.filename = filename;
    }

    public static SuiteConfigException unreadable(Path filename, Throwable cause) {
        return new SuiteConfigException("cannot read the test suite config file", filename, cause);
    }

    public static SuiteConfigException invalid(Path filename, Throwable cause) {
        return new SuiteConfigException("invalid test suite config file", filename, cause);
    }

    public Path getFilename() {
        return filename;
    }
}
