package com.batrun.core.model;

import java.util.Optional;

/**
 * Setup and teardown cases scoped to a whole test suite (the global fixture file).
 * Either may be absent.
 */
public record TestSuiteFixture(TestCase setup, TestCase teardown) {

    private static final TestSuiteFixture NONE = new TestSuiteFixture(null, null);

    public static TestSuiteFixture none() {
        return NONE;
    }

    public Optional<TestCase> setupTestCase() {
        return Optional.ofNullable(setup);
    }

    public Optional<TestCase> teardownTestCase() {
        return Optional.ofNullable(teardown);
    }
}
