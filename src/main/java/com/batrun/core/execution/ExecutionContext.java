package com.batrun.core.execution;

import com.batrun.core.error.BatrunException;
import com.batrun.core.error.OutputDirectoryException;
import com.batrun.core.logging.MdcContext;
import com.batrun.core.model.ShouldSkip;
import com.batrun.core.model.SkipReason;
import com.batrun.core.model.Statistics;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestCaseRole;
import com.batrun.core.model.TestCaseStatus;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuiteStatus;
import com.batrun.core.visitor.TestSuiteVisitor;
import com.batrun.driver.TestDriver;
import com.batrun.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Execution bookkeeping of one test suite for one target.
 * <p>
 * Holds one {@link TestCaseExecInfo} per test case of the suite and runs a single
 * case through a {@link TestDriver}. It does not decide the traversal order: an
 * executor feeds it the cases yielded by a {@link TestSuiteVisitor}.
 * <p>
 * A context is mutated by a single executor thread at a time; reporters may read
 * it concurrently.
 */
public class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    static final String FILTERED_OUT = "filtered out";

    /**
     * Execution policy applied by {@link #run}.
     *
     * @param dryRun                 walk every case but invoke no driver
     * @param testFilter             only test cases whose id contains a match are run (nullable)
     * @param runTeardownWhenSkipped invoke the driver for teardown cases even under a skip flag
     */
    public record Options(boolean dryRun, Pattern testFilter, boolean runTeardownWhenSkipped) {

        public static Options defaults() {
            return new Options(false, null, false);
        }

        boolean selects(TestCase testCase) {
            return testFilter == null || testFilter.matcher(testCase.id()).find();
        }
    }

    private final TestSuite testSuite;
    private final String target;
    private final Options options;
    private final Clock clock;
    private final Map<TestCase, TestCaseExecInfo> execInfos;

    private volatile TestSuiteStatus status = TestSuiteStatus.NOT_RUN;
    private volatile String abortReason;
    private volatile TimeInterval suiteDuration;

    public ExecutionContext(TestSuite testSuite, String target) {
        this(testSuite, target, Options.defaults(), Clock.systemUTC());
    }

    public ExecutionContext(TestSuite testSuite, String target, Options options) {
        this(testSuite, target, options, Clock.systemUTC());
    }

    public ExecutionContext(TestSuite testSuite, String target, Options options, Clock clock) {
        this.testSuite = testSuite;
        this.target = target;
        this.options = options;
        this.clock = clock;
        var infos = new LinkedHashMap<TestCase, TestCaseExecInfo>();
        TestSuiteVisitor.forEach(testSuite, (testCase, role) -> infos.put(testCase, new TestCaseExecInfo(clock)));
        this.execInfos = Collections.unmodifiableMap(infos);
    }

    /**
     * Creates the output directory of every test case,
     * {@code {outputRoot}/{target}/{test file path}/}, and records it.
     *
     * @throws OutputDirectoryException if a directory cannot be created
     */
    public void prepare(Path outputRoot) {
        for (var entry : execInfos.entrySet()) {
            Path outDir = outDirFor(outputRoot, entry.getKey());
            try {
                Files.createDirectories(outDir);
            } catch (IOException e) {
                throw new OutputDirectoryException(outDir, e);
            }
            entry.getValue().setOutDir(outDir);
        }
        log.debug("Prepared {} output directories for target {} under {}", execInfos.size(), target, outputRoot);
    }

    public Path outDirFor(Path outputRoot, TestCase testCase) {
        return outputRoot.resolve(target).resolve(testCase.path());
    }

    /**
     * Runs one test case and records its outcome.
     * <p>
     * A case carrying a "yes" skip directive is recorded as skipped without
     * invoking the driver, except teardown cases when
     * {@link Options#runTeardownWhenSkipped()} is set. Driver errors are recorded
     * as {@link TestCaseStatus#RUNNER_FAILED}; they never propagate.
     *
     * @return {@code true} if the case passed (or was dry-run); a setup returning
     *         {@code false} makes the visitor skip its scope
     */
    public boolean run(TestDriver driver, TestCase testCase, TestCaseRole role,
                       ShouldSkip shouldSkip, Reporter reporter) {
        var execInfo = execInfos.get(testCase);
        if (execInfo == null) {
            throw new IllegalArgumentException("Test case " + testCase.id() + " is not part of " + testSuite.path());
        }
        MdcContext.setTestCase(testSuite.path().toString(), target, testCase.id());
        try {
            execInfo.setStatus(TestCaseStatus.RUNNING);
            reporter.reportTestCaseExecutionStarted(testCase, target, execInfo);
            execute(driver, testCase, role, shouldSkip, execInfo);
            log.debug("{} [{}] on {}: {}", testCase.id(), role, target, execInfo.status());
            reporter.reportTestCaseExecutionResult(testCase, target, execInfo);
        } finally {
            MdcContext.clearTestCase();
        }
        var outcome = execInfo.status();
        return outcome == TestCaseStatus.PASSED || outcome == TestCaseStatus.DRY_RUN;
    }

    private void execute(TestDriver driver, TestCase testCase, TestCaseRole role,
                         ShouldSkip shouldSkip, TestCaseExecInfo execInfo) {
        var skipReason = shouldSkip.reason();
        if (skipReason.isPresent()) {
            if (!(role.isTeardown() && options.runTeardownWhenSkipped())) {
                execInfo.markSkipped(skipReason.get());
                return;
            }
            log.debug("Running teardown {} on {} despite: {}", testCase.id(), target, skipReason.get());
        }
        if (options.dryRun()) {
            execInfo.setStatus(TestCaseStatus.DRY_RUN);
            return;
        }
        if (role == TestCaseRole.TEST && !options.selects(testCase)) {
            execInfo.markSkipped(SkipReason.testCaseSpecific(FILTERED_OUT));
            return;
        }

        Path outDir = execInfo.outDir().orElseThrow(() ->
                new IllegalStateException("Execution context for target " + target + " was not prepared"));
        try {
            var output = driver.runTest(testSuite.path(), testSuite.config(), target, testCase, outDir);
            execInfo.setDriverOutput(output.driverOutput());
            if (output.status() == TestCaseStatus.SKIPPED) {
                execInfo.markSkipped(output.skipReason());
            } else {
                execInfo.setStatus(output.status());
            }
        } catch (BatrunException e) {
            log.warn("Runner failure for {} on {}: {}", testCase.id(), target, e.getMessage());
            execInfo.markRunnerFailed(e.getDetails().isEmpty() ? e.getMessage() : e.getMessage() + ": " + e.getDetails());
        } catch (RuntimeException e) {
            log.error("Unexpected error running {} on {}", testCase.id(), target, e);
            execInfo.markRunnerFailed(e.toString());
        }
    }

    public void begin() {
        if (status == TestSuiteStatus.NOT_RUN) {
            suiteDuration = new TimeInterval(clock);
            status = TestSuiteStatus.RUNNING;
        }
    }

    public void finish() {
        if (status == TestSuiteStatus.RUNNING) {
            suiteDuration.stop();
            status = TestSuiteStatus.FINISHED;
        }
    }

    /**
     * Marks the execution as aborted; executors stop feeding this context further
     * test cases. The case in flight, if any, keeps whatever status it reached.
     */
    public void abort(String reason) {
        if (status == TestSuiteStatus.FINISHED || status == TestSuiteStatus.ABORTED) {
            return;
        }
        log.info("Aborting execution for target {}: {}", target, reason);
        abortReason = reason;
        if (suiteDuration != null) {
            suiteDuration.stop();
        }
        status = TestSuiteStatus.ABORTED;
    }

    public boolean isAborted() {
        return status == TestSuiteStatus.ABORTED;
    }

    /**
     * Recomputes the statistics from the current test case statuses. Safe to call
     * at any time, including while the execution is in progress.
     */
    public Statistics statistics() {
        return Statistics.of(execInfos.values().stream().map(TestCaseExecInfo::status).toList());
    }

    public TestSuite testSuite() {
        return testSuite;
    }

    public String target() {
        return target;
    }

    public Options options() {
        return options;
    }

    public TestSuiteStatus status() {
        return status;
    }

    public Optional<String> abortReason() {
        return Optional.ofNullable(abortReason);
    }

    public Optional<Duration> duration() {
        var interval = suiteDuration;
        return interval == null ? Optional.empty() : interval.elapsed();
    }

    public TestCaseExecInfo execInfo(TestCase testCase) {
        return execInfos.get(testCase);
    }

    /**
     * Returns every test case record, in traversal order.
     */
    public Map<TestCase, TestCaseExecInfo> execInfos() {
        return execInfos;
    }
}
