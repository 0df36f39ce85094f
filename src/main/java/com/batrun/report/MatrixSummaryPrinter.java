package com.batrun.report;

import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestCaseStatus;
import com.batrun.core.model.TestSuite;

import java.util.List;

/**
 * Prints a suite's results as a matrix: one row per test case, one column per
 * target, with the target headers stacked above their column.
 *
 * <pre>
 *                      ┌─ dev-a    1 passed, 0 failed, 0 runner failed, 1 skipped
 *                      │ ┌─ dev-b  0 passed, 1 failed, 0 runner failed, 1 skipped
 * fixture.sh::setup    V X
 * 01-test.sh::test_one &gt; &gt;
 * </pre>
 */
class MatrixSummaryPrinter {

    static final String CHAR_PASS = "V";
    static final String CHAR_FAIL = "X";
    static final String CHAR_RUNNER_FAIL = "O";
    static final String CHAR_SKIP = ">";
    static final String CHAR_PENDING = "?";

    private final ConsoleOutput console;

    MatrixSummaryPrinter(ConsoleOutput console) {
        this.console = console;
    }

    void print(TestSuite testSuite, List<ExecutionContext> executionContexts) {
        List<TestCase> testCases = testSuite.testCases();
        int rowWidth = testCases.stream().mapToInt(tc -> tc.id().length()).max().orElse(0);
        int columnWidth = executionContexts.stream().mapToInt(c -> c.target().length()).max().orElse(0);

        int depth = 0;
        for (ExecutionContext context : executionContexts) {
            var header = new StringBuilder();
            header.append(" ".repeat(rowWidth + 1));
            header.append("│ ".repeat(depth));
            header.append("┌─ ").append(context.target());
            header.append(" ".repeat(columnWidth - context.target().length()
                    + (executionContexts.size() - depth) * 2));
            console.println(header + HumanFriendlyReporter.formatStatistics(context.statistics()));
            depth++;
        }

        for (TestCase testCase : testCases) {
            var row = new StringBuilder();
            row.append(testCase.id()).append(' ');
            row.append(" ".repeat(rowWidth - testCase.id().length()));
            for (ExecutionContext context : executionContexts) {
                row.append(cell(context.execInfo(testCase).status())).append(' ');
            }
            console.println(row.toString());
        }
    }

    static String cell(TestCaseStatus status) {
        return switch (status) {
            case PASSED -> ConsoleOutput.green(CHAR_PASS);
            case FAILED -> ConsoleOutput.red(CHAR_FAIL);
            case RUNNER_FAILED -> ConsoleOutput.red(CHAR_RUNNER_FAIL);
            case SKIPPED, DRY_RUN -> ConsoleOutput.faint(CHAR_SKIP);
            case NOT_RUN, RUNNING -> CHAR_PENDING;
        };
    }
}
