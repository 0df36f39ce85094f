package com.batrun.core.model;

/**
 * Position of a visited test case in the suite hierarchy.
 */
public enum TestCaseRole {
    SUITE_SETUP,
    FILE_SETUP,
    TEST,
    FILE_TEARDOWN,
    SUITE_TEARDOWN;

    public boolean isSetup() {
        return this == SUITE_SETUP || this == FILE_SETUP;
    }

    public boolean isTeardown() {
        return this == FILE_TEARDOWN || this == SUITE_TEARDOWN;
    }
}
