package com.batrun.core.error;

import java.nio.file.Path;

public class UnknownTestSuiteException extends BatrunException {
    public UnknownTestSuiteException(Path testSuiteDir) {
        super("unknown test suite at `" + testSuiteDir + "`");
    }
}
