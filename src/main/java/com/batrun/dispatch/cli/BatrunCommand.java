package com.batrun.dispatch.cli;

import com.batrun.core.config.BatrunProperties;
import com.batrun.core.error.BatrunException;
import com.batrun.core.metrics.BatrunMetrics;
import com.batrun.core.model.ExecutionStrategy;
import com.batrun.core.runner.Settings;
import com.batrun.core.runner.TestRunner;
import com.batrun.core.suite.TestSuiteConfigLoader;
import com.batrun.driver.TestDriverRegistry;
import com.batrun.report.CompositeReporter;
import com.batrun.report.HumanFriendlyReporter;
import com.batrun.report.MetricsReporter;
import com.batrun.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * CLI command: batrun [OPTIONS] TEST_SUITE_DIR...
 * <p>
 * Loads the given test suites, then lists their targets or tests, or runs them
 * on the selected targets. Options left unset fall back to the {@code batrun.*}
 * properties.
 */
@Command(
        name = "batrun",
        mixinStandardHelpOptions = true,
        version = "batrun 0.1.0",
        description = "Runs test suites on one or more targets"
)
@Component
public class BatrunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatrunCommand.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    @Parameters(arity = "1..*", paramLabel = "TEST_SUITE_DIR",
            description = "Directory where the test suite is located")
    List<Path> testSuiteDirs = new ArrayList<>();

    @Option(names = {"-o", "--out-dir"}, description = "Output directory for logs and data")
    Path outDir;

    @Option(names = {"-t", "--target"}, arity = "1..*",
            description = "Targets to run the tests on; all targets of the suite if not provided")
    List<String> targets = new ArrayList<>();

    @Option(names = {"-L", "--list-targets"}, description = "List targets supported by the test suites")
    boolean listTargets;

    @Option(names = {"-l", "--list-tests"}, description = "List tests available in the test suites")
    boolean listTests;

    @Option(names = {"-s", "--exec-strategy"},
            description = "Test cases execution strategy: ${COMPLETION-CANDIDATES}")
    ExecutionStrategy strategy;

    @Option(names = {"-n", "--dry-run"}, description = "Go through all tests but execute nothing")
    boolean dryRun;

    @Option(names = {"-f", "--filter"}, description = "Only run test cases whose id matches this regex")
    Pattern filter;

    @Option(names = {"-j", "--max-parallel"},
            description = "Maximum number of targets run concurrently by the parallel strategy")
    Integer maxParallel;

    @Option(names = "--run-teardown-when-skipped",
            description = "Execute teardown test cases even when their scope is skipped")
    boolean runTeardownWhenSkipped;

    @Option(names = {"-d", "--debug"}, description = "Output additional logs helping to debug batrun itself")
    boolean debug;

    @Option(names = {"-m", "--matrix-summary"},
            description = "Print the summary as a matrix with test cases in rows and targets in columns")
    boolean matrixSummary;

    private final TestDriverRegistry testDrivers;
    private final TestSuiteConfigLoader configLoader;
    private final BatrunProperties properties;
    private final BatrunMetrics metrics;
    private final LoggingSystem loggingSystem;

    public BatrunCommand(TestDriverRegistry testDrivers, TestSuiteConfigLoader configLoader,
                         BatrunProperties properties, BatrunMetrics metrics,
                         @Autowired(required = false) LoggingSystem loggingSystem) {
        this.testDrivers = testDrivers;
        this.configLoader = configLoader;
        this.properties = properties;
        this.metrics = metrics;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public Integer call() {
        Settings settings = settings();
        if (settings.debug() && loggingSystem != null) {
            loggingSystem.setLogLevel("com.batrun", LogLevel.DEBUG);
        }
        log.debug("Settings: {}", settings);

        Reporter reporter = new CompositeReporter(
                new HumanFriendlyReporter(settings.debug(), settings.matrixSummary()),
                new MetricsReporter(metrics, settings.strategy()));
        var testRunner = new TestRunner(settings, testDrivers, configLoader, reporter);

        Instant start = Instant.now();
        try {
            testRunner.loadTestSuites();
        } catch (BatrunException e) {
            // already reported per suite
            log.debug("Test suite loading failed", e);
            return 1;
        }

        try (var stopOnShutdown = new StopOnShutdown(testRunner, SHUTDOWN_GRACE).install()) {
            for (Path testSuiteDir : settings.testSuiteDirs()) {
                boolean runTests = true;
                if (listTargets) {
                    runTests = false;
                    testRunner.listTargets(testSuiteDir);
                }
                if (listTests) {
                    runTests = false;
                    testRunner.listTests(testSuiteDir);
                }
                if (runTests) {
                    testRunner.runTests(testSuiteDir);
                }
            }
        } catch (BatrunException e) {
            reporter.errorFrom(e);
            return 1;
        }

        reporter.reportTotalTime(Duration.between(start, Instant.now()));
        return 0;
    }

    Settings settings() {
        return new Settings(
                testSuiteDirs,
                outDir != null ? outDir : Path.of(properties.getOutDir()),
                targets,
                strategy != null ? strategy : properties.getStrategy(),
                maxParallel != null ? maxParallel : properties.getMaxParallel(),
                dryRun,
                filter,
                runTeardownWhenSkipped || properties.isRunTeardownWhenSkipped(),
                debug,
                matrixSummary || properties.isMatrixSummary());
    }
}
