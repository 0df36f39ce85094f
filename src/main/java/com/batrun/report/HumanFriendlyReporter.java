package com.batrun.report;

import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.execution.TestCaseExecInfo;
import com.batrun.core.model.Statistics;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestSuite;

import java.time.Duration;
import java.util.List;

import static com.batrun.report.ConsoleOutput.bold;
import static com.batrun.report.ConsoleOutput.cyan;
import static com.batrun.report.ConsoleOutput.faint;
import static com.batrun.report.ConsoleOutput.formatDuration;
import static com.batrun.report.ConsoleOutput.green;
import static com.batrun.report.ConsoleOutput.red;
import static com.batrun.report.ConsoleOutput.yellow;

/**
 * Console reporter: one line per test case result, then per-target summaries or
 * a result matrix.
 * <p>
 * All methods are synchronized so lines from parallel workers never interleave.
 */
public class HumanFriendlyReporter implements Reporter {

    private final boolean debugEnabled;
    private final boolean matrixSummary;
    private final ConsoleOutput console;

    public HumanFriendlyReporter(boolean debugEnabled, boolean matrixSummary) {
        this(debugEnabled, matrixSummary, new ConsoleOutput());
    }

    public HumanFriendlyReporter(boolean debugEnabled, boolean matrixSummary, ConsoleOutput console) {
        this.debugEnabled = debugEnabled;
        this.matrixSummary = matrixSummary;
        this.console = console;
    }

    @Override
    public synchronized void noticeDetailed(String message, String details) {
        printWithDetails("", message, details);
    }

    @Override
    public synchronized void infoDetailed(String message, String details) {
        printWithDetails(cyan("Info:") + " ", message, details);
    }

    @Override
    public synchronized void warningDetailed(String message, String details) {
        printWithDetails(yellow("Warning:") + " ", message, details);
    }

    @Override
    public synchronized void errorDetailed(String message, String details) {
        printWithDetails(red("Error:") + " ", message, details);
    }

    private void printWithDetails(String prefix, String message, String details) {
        console.println(prefix + bold(message));
        if (details != null && !details.isEmpty()) {
            details.lines().forEach(line -> console.println("  " + line));
        }
    }

    @Override
    public synchronized void reportTargetList(TestSuite testSuite) {
        console.println(bold("Targets supported by test suite `" + testSuite.path() + "`"));
        for (String target : testSuite.config().targets()) {
            console.println("  " + target);
        }
        console.println();
    }

    @Override
    public synchronized void reportTestList(TestSuite testSuite) {
        console.println(bold("Tests defined in test suite `" + testSuite.path() + "`"));
        for (TestCase testCase : testSuite.testCases()) {
            console.println("  " + testCase.id());
        }
        console.println();
    }

    @Override
    public synchronized void reportTestSuiteExecutionSummary(TestSuite testSuite,
                                                             List<ExecutionContext> executionContexts) {
        if (matrixSummary) {
            console.println();
            console.println(bold("Test suite `" + testSuite.path() + "` execution summary"));
            new MatrixSummaryPrinter(console).print(testSuite, executionContexts);
            return;
        }
        for (ExecutionContext context : executionContexts) {
            console.println();
            console.println(bold("Test suite `" + testSuite.path() + "` execution summary"));
            console.println("  Target: " + context.target());
            console.println("  Status: " + context.status()
                    + context.abortReason().map(reason -> " (" + reason + ")").orElse(""));
            context.duration().ifPresent(d -> console.println("  Duration: " + formatDuration(d)));
            console.println("  Statistics: " + formatStatistics(context.statistics()));
        }
    }

    static String formatStatistics(Statistics statistics) {
        return green(statistics.passed() + " passed") + ", "
                + red(statistics.failed() + " failed") + ", "
                + red(statistics.runnerFailed() + " runner failed") + ", "
                + faint(statistics.skipped() + " skipped");
    }

    @Override
    public synchronized void reportTotalTime(Duration duration) {
        console.println();
        console.println(bold("Time elapsed: " + formatDuration(duration)));
    }

    @Override
    public synchronized void reportTestCaseExecutionStarted(TestCase testCase, String target,
                                                            TestCaseExecInfo execInfo) {
        if (debugEnabled) {
            console.println(faint("Running test case `" + testCase.id() + "` for target `" + target + "`"));
        }
    }

    @Override
    public synchronized void reportTestCaseExecutionResult(TestCase testCase, String target,
                                                           TestCaseExecInfo execInfo) {
        String duration = execInfo.duration().map(d -> " (" + formatDuration(d) + ")").orElse("");
        String outcome = switch (execInfo.status()) {
            case PASSED -> green("PASSED") + duration;
            case FAILED -> red("FAILED") + duration;
            case RUNNER_FAILED -> red("RUNNER_FAILED");
            case SKIPPED -> faint("SKIPPED")
                    + execInfo.skipReason().map(r -> " (" + r.describe() + ")").orElse("");
            case DRY_RUN -> faint("DRY_RUN");
            case NOT_RUN -> faint("NOT_RUN");
            case RUNNING -> faint("RUNNING");
        };
        console.println("[" + target + "] " + testCase.id() + " " + outcome);
        execInfo.runnerError().ifPresent(error -> console.println("  " + error));
        if (debugEnabled) {
            execInfo.driverOutput().ifPresent(output -> console.println(faint("  output: " + output)));
        }
    }
}
