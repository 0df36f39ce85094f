package com.batrun.core.model;

/**
 * Overall status of a test suite execution for one target.
 */
public enum TestSuiteStatus {
    NOT_RUN,
    RUNNING,
    ABORTED,
    FINISHED
}
