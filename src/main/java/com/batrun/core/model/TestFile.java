package com.batrun.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A test file of a suite: an optional local fixture and its test cases in
 * execution order.
 *
 * @param path      file path relative to the test suite directory
 * @param setup     setup case run before the file's test cases (nullable)
 * @param teardown  teardown case run after the file's test cases (nullable)
 * @param testCases test cases in discovery order
 */
public record TestFile(
    Path path,
    TestCase setup,
    TestCase teardown,
    List<TestCase> testCases
) {

    public TestFile {
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }

    public Optional<TestCase> setupTestCase() {
        return Optional.ofNullable(setup);
    }

    public Optional<TestCase> teardownTestCase() {
        return Optional.ofNullable(teardown);
    }
}
