package com.batrun.core.model;

/**
 * Execution status of an individual test case for one target.
 */
public enum TestCaseStatus {
    NOT_RUN,
    RUNNING,
    PASSED,
    FAILED,
    RUNNER_FAILED,  // the driver could not execute the case at all
    SKIPPED,
    DRY_RUN;

    public boolean isTerminal() {
        return this != NOT_RUN && this != RUNNING;
    }
}
