package com.batrun.core.suite;

import com.batrun.core.error.UnknownTestSuiteException;
import com.batrun.core.model.TestSuite;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Test suites loaded for a run, keyed by their normalised absolute directory.
 */
public class TestSuiteRegistry {

    private final Map<Path, TestSuite> testSuites = new LinkedHashMap<>();

    public void insert(Path testSuiteDir, TestSuite testSuite) {
        testSuites.put(key(testSuiteDir), testSuite);
    }

    /**
     * @throws UnknownTestSuiteException if no suite was loaded from {@code testSuiteDir}
     */
    public TestSuite get(Path testSuiteDir) {
        var testSuite = testSuites.get(key(testSuiteDir));
        if (testSuite == null) {
            throw new UnknownTestSuiteException(testSuiteDir);
        }
        return testSuite;
    }

    public boolean contains(Path testSuiteDir) {
        return testSuites.containsKey(key(testSuiteDir));
    }

    public Collection<TestSuite> all() {
        return Collections.unmodifiableCollection(testSuites.values());
    }

    private static Path key(Path testSuiteDir) {
        return testSuiteDir.toAbsolutePath().normalize();
    }
}
