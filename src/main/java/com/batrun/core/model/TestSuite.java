package com.batrun.core.model;

import com.batrun.core.visitor.TestSuiteVisitor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hierarchical test definition of one suite directory: the global fixture and the
 * test files, each holding its own local fixture and test cases.
 * <p>
 * Built once by a test driver's discovery step and read-only afterwards; all
 * execution bookkeeping is held by execution contexts.
 */
public class TestSuite {

    private final Path path;
    private final TestSuiteConfig config;
    private final TestSuiteFixture fixture;
    private final List<TestFile> testFiles;

    public TestSuite(Path path, TestSuiteConfig config, List<TestFile> testFiles, TestSuiteFixture fixture) {
        this.path = path.toAbsolutePath().normalize();
        this.config = config;
        this.fixture = fixture != null ? fixture : TestSuiteFixture.none();
        this.testFiles = List.copyOf(testFiles);
    }

    public Path path() {
        return path;
    }

    public TestSuiteConfig config() {
        return config;
    }

    public TestSuiteFixture fixture() {
        return fixture;
    }

    public List<TestFile> testFiles() {
        return testFiles;
    }

    /**
     * Returns every test case of the suite (fixtures included) in traversal order.
     */
    public List<TestCase> testCases() {
        var all = new ArrayList<TestCase>();
        TestSuiteVisitor.forEach(this, (testCase, role) -> all.add(testCase));
        return all;
    }

    public Optional<TestCase> findTestCase(String id) {
        return testCases().stream().filter(tc -> tc.id().equals(id)).findFirst();
    }

    @Override
    public String toString() {
        return "TestSuite[" + path + ", " + testFiles.size() + " files]";
    }
}
