package com.batrun.driver;

import com.batrun.core.error.BatrunException;
import com.batrun.core.error.TestDriverException;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Knows how to discover the test cases of a suite written for it and how to run
 * one of them against a target.
 * <p>
 * Implementations are registered as Spring beans and looked up by {@link #name()}
 * from the {@code driver} entry of a suite's config.
 */
public interface TestDriver {

    /**
     * Name used in {@code test-suite.json} to select this driver.
     */
    String name();

    /**
     * File patterns used when the suite config does not declare any.
     */
    List<String> testFilePatternsDefault();

    /**
     * Walks the test suite and builds its model. Files must be sorted by path and,
     * within a file, test cases kept in a stable order.
     *
     * @throws BatrunException if a file cannot be evaluated or a name is ambiguous
     */
    TestSuite discoverTests(Path testSuiteDir, TestSuiteConfig config);

    /**
     * Runs one test case for one target.
     *
     * @param outDir directory where the case writes its logs and artifacts
     * @return the status the case reported
     * @throws TestDriverException if the case could not be executed at all
     */
    RunTestOutput runTest(Path testSuiteDir, TestSuiteConfig config, String target,
                          TestCase testCase, Path outDir);

    default List<String> testFilePatterns(TestSuiteConfig config) {
        return config.testFilePatterns().isEmpty() ? testFilePatternsDefault() : config.testFilePatterns();
    }

    /**
     * Returns {@code true} if {@code relativePath} matches one of the suite's file
     * patterns. Patterns without a {@code /} are matched against the file name,
     * the others against the path relative to the suite directory.
     */
    default boolean matchesFilePattern(Path relativePath, TestSuiteConfig config) {
        for (String pattern : testFilePatterns(config)) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            Path candidate = pattern.contains("/") ? relativePath : relativePath.getFileName();
            if (candidate != null && matcher.matches(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the paths, relative to {@code testSuiteDir} and sorted, of every
     * regular file matching the suite's patterns, the global fixture file excluded.
     */
    default List<Path> discoverTestFiles(Path testSuiteDir, TestSuiteConfig config) {
        Path globalFixture = config.globalFixtureFile().map(Path::of).map(Path::normalize).orElse(null);
        try (var stream = Files.walk(testSuiteDir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(p -> testSuiteDir.relativize(p).normalize())
                    .filter(p -> matchesFilePattern(p, config))
                    .filter(p -> !p.equals(globalFixture))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new BatrunException("cannot walk test suite directory `" + testSuiteDir + "`", e);
        }
    }
}
