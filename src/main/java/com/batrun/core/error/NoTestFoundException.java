package com.batrun.core.error;

import java.nio.file.Path;

public class NoTestFoundException extends BatrunException {
    public NoTestFoundException(Path testSuiteDir) {
        super("no test found in test suite `" + testSuiteDir + "`");
    }
}
