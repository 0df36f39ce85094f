package com.batrun.core.runner;

import com.batrun.core.error.BatrunException;
import com.batrun.core.error.OutputDirectoryException;
import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.execution.TestExecutors;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuiteConfig;
import com.batrun.core.suite.TestSuiteConfigLoader;
import com.batrun.core.suite.TestSuiteRegistry;
import com.batrun.driver.TestDriver;
import com.batrun.driver.TestDriverRegistry;
import com.batrun.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of an execution: loads the test suites named by the
 * {@link Settings}, lists them or runs them with the selected strategy.
 */
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private final Settings settings;
    private final TestDriverRegistry testDrivers;
    private final TestSuiteConfigLoader configLoader;
    private final Reporter reporter;
    private final TestSuiteRegistry testSuites = new TestSuiteRegistry();

    private volatile List<ExecutionContext> activeContexts = List.of();
    private volatile String stopReason;

    public TestRunner(Settings settings, TestDriverRegistry testDrivers,
                      TestSuiteConfigLoader configLoader, Reporter reporter) {
        this.settings = settings;
        this.testDrivers = testDrivers;
        this.configLoader = configLoader;
        this.reporter = reporter;
    }

    /**
     * Loads every suite directory of the settings. A suite that fails to load is
     * reported and the others are still attempted.
     *
     * @throws BatrunException the last load error, once all suites were attempted
     */
    public void loadTestSuites() {
        BatrunException lastError = null;
        for (Path testSuiteDir : settings.testSuiteDirs()) {
            try {
                loadTestSuite(testSuiteDir);
            } catch (BatrunException e) {
                log.warn("Failed to load test suite {}: {}", testSuiteDir, e.getMessage());
                reporter.errorFrom(e);
                lastError = e;
            }
        }
        if (lastError != null) {
            throw lastError;
        }
    }

    private void loadTestSuite(Path testSuiteDir) {
        TestSuiteConfig config = configLoader.load(testSuiteDir);
        TestDriver driver = testDrivers.get(config.driver());
        TestSuite testSuite = driver.discoverTests(testSuiteDir, config);
        testSuites.insert(testSuiteDir, testSuite);
        log.info("Loaded test suite {} ({} test cases, driver {})",
                testSuite.path(), testSuite.testCases().size(), driver.name());
    }

    public void listTests(Path testSuiteDir) {
        reporter.reportTestList(testSuites.get(testSuiteDir));
    }

    public void listTargets(Path testSuiteDir) {
        reporter.reportTargetList(testSuites.get(testSuiteDir));
    }

    /**
     * Runs a loaded suite on the selected targets and reports its summary.
     *
     * @return one finished (or aborted) execution context per target
     */
    public List<ExecutionContext> runTests(Path testSuiteDir) {
        TestSuite testSuite = testSuites.get(testSuiteDir);
        TestDriver driver = testDrivers.get(testSuite.config().driver());
        prepareOutDir();

        List<String> targets = selectTargets(testSuite);
        if (targets.isEmpty()) {
            reporter.warning("No target selected for test suite `" + testSuite.path() + "`");
            return List.of();
        }

        var options = new ExecutionContext.Options(
                settings.dryRun(), settings.testFilter(), settings.runTeardownWhenSkipped());
        var contexts = new ArrayList<ExecutionContext>();
        for (String target : targets) {
            var context = new ExecutionContext(testSuite, target, options);
            context.prepare(settings.outDir());
            contexts.add(context);
        }

        activeContexts = List.copyOf(contexts);
        try {
            if (stopReason != null) {
                contexts.forEach(c -> c.abort(stopReason));
            }
            log.info("Running {} on {} target(s) with strategy {}",
                    testSuite.path(), contexts.size(), settings.strategy());
            TestExecutors.forStrategy(settings.strategy(), settings.maxParallel())
                    .execute(reporter, driver, testSuite, contexts);
        } finally {
            activeContexts = List.of();
        }

        reporter.reportTestSuiteExecutionSummary(testSuite, contexts);
        return contexts;
    }

    /**
     * Aborts the contexts currently running and any later run. The test cases in
     * flight complete; no further case is started.
     */
    public void requestStop(String reason) {
        stopReason = reason;
        for (ExecutionContext context : activeContexts) {
            context.abort(reason);
        }
    }

    private List<String> selectTargets(TestSuite testSuite) {
        List<String> declared = testSuite.config().targets();
        if (settings.targets().isEmpty()) {
            return declared;
        }
        for (String target : settings.targets()) {
            if (!declared.contains(target)) {
                reporter.warning("Target `" + target + "` is not declared by test suite `"
                        + testSuite.path() + "`");
            }
        }
        return settings.targets();
    }

    private void prepareOutDir() {
        Path outDir = settings.outDir();
        if (Files.exists(outDir)) {
            reporter.warning("Output directory `" + outDir + "` already exists. Contents may be overwritten.");
            return;
        }
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new OutputDirectoryException(outDir, e);
        }
        reporter.info("Output directory `" + outDir + "` created.");
    }

    public Settings settings() {
        return settings;
    }

    public TestSuiteRegistry testSuites() {
        return testSuites;
    }
}
