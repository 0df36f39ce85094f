package com.batrun.report;

import com.batrun.core.error.TestFileExecException;
import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.execution.SequentialExecutor;
import com.batrun.core.execution.TestCaseExecInfo;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestCaseStatus;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuites;
import com.batrun.driver.RecordingTestDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HumanFriendlyReporterTest {

    @TempDir
    Path outRoot;

    private ByteArrayOutputStream buffer;
    private TestSuite suite;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        suite = TestSuites.sample();
    }

    private HumanFriendlyReporter reporter(boolean debug, boolean matrix) {
        var console = new ConsoleOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8), CommandLine.Help.Ansi.OFF);
        return new HumanFriendlyReporter(debug, matrix, console);
    }

    private List<String> lines() {
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private List<ExecutionContext> runTwoTargets() {
        var driver = new RecordingTestDriver(suite).failing("t2", "fixture.sh::setup");
        var contexts = List.of(new ExecutionContext(suite, "t1"), new ExecutionContext(suite, "t2"));
        contexts.forEach(c -> c.prepare(outRoot));
        new SequentialExecutor().execute(new CompositeReporter(), driver, suite, contexts);
        return contexts;
    }

    @Nested
    @DisplayName("Messages")
    class Messages {

        @Test
        @DisplayName("levels are prefixed and details indented below")
        void prefixes() {
            var reporter = reporter(false, false);

            reporter.notice("plain");
            reporter.info("note");
            reporter.warning("careful");
            reporter.errorDetailed("broken", "line 1\nline 2");

            assertEquals(List.of("plain", "Info: note", "Warning: careful", "Error: broken", "  line 1", "  line 2"),
                    lines());
        }

        @Test
        @DisplayName("errorFrom prints the exception details")
        void errorFrom() {
            reporter(false, false).errorFrom(new TestFileExecException(Path.of("a.sh"), "syntax error"));

            assertEquals(List.of("Error: cannot execute test file `a.sh`", "  syntax error"), lines());
        }
    }

    @Nested
    @DisplayName("Listings")
    class Listings {

        @Test
        void testList() {
            reporter(false, false).reportTestList(suite);

            var lines = lines();
            assertTrue(lines.get(0).startsWith("Tests defined in test suite"));
            assertEquals("  fixture.sh::setup", lines.get(1));
            assertEquals("  fixture.sh::teardown", lines.get(7));
        }

        @Test
        void targetList() {
            reporter(false, false).reportTargetList(suite);

            assertEquals(List.of("  t1", "  t2"), lines().subList(1, 3));
        }
    }

    @Nested
    @DisplayName("Results")
    class Results {

        @Test
        @DisplayName("one line per result with target, id, status and duration")
        void resultLine() {
            var info = new TestCaseExecInfo();
            info.setStatus(TestCaseStatus.RUNNING);
            info.setStatus(TestCaseStatus.PASSED);

            reporter(false, false).reportTestCaseExecutionResult(TestCase.of("a.sh", "test_1"), "dev", info);

            assertEquals(List.of("[dev] a.sh::test_1 PASSED (0s)"), lines());
        }

        @Test
        @DisplayName("skipped results show their reason")
        void skippedLine() {
            var contexts = runTwoTargets();
            var testCase = TestCase.of("a.sh", "test_1");

            reporter(false, false).reportTestCaseExecutionResult(testCase, "t2", contexts.get(1).execInfo(testCase));

            assertEquals(List.of("[t2] a.sh::test_1 SKIPPED (test suite setup failed)"), lines());
        }

        @Test
        @DisplayName("the started hook prints only in debug mode")
        void startedHook() {
            var info = new TestCaseExecInfo();
            reporter(false, false).reportTestCaseExecutionStarted(TestCase.of("a.sh", "test_1"), "dev", info);
            assertTrue(lines().isEmpty());

            reporter(true, false).reportTestCaseExecutionStarted(TestCase.of("a.sh", "test_1"), "dev", info);
            assertEquals(List.of("Running test case `a.sh::test_1` for target `dev`"), lines());
        }

        @Test
        void totalTime() {
            reporter(false, false).reportTotalTime(Duration.ofSeconds(75));
            assertEquals("Time elapsed: 1m 15s", lines().get(1));
        }
    }

    @Nested
    @DisplayName("Summaries")
    class Summaries {

        @Test
        @DisplayName("one block per target with status and statistics")
        void perTargetSummary() {
            var contexts = runTwoTargets();

            reporter(false, false).reportTestSuiteExecutionSummary(suite, contexts);

            var lines = lines();
            assertTrue(lines.contains("  Target: t1"));
            assertTrue(lines.contains("  Target: t2"));
            assertTrue(lines.contains("  Status: FINISHED"));
            assertTrue(lines.contains("  Statistics: 7 passed, 0 failed, 0 runner failed, 0 skipped"));
            assertTrue(lines.contains("  Statistics: 0 passed, 1 failed, 0 runner failed, 6 skipped"));
        }

        @Test
        @DisplayName("matrix has a header per target and a row per test case")
        void matrixSummary() {
            var contexts = runTwoTargets();

            reporter(false, true).reportTestSuiteExecutionSummary(suite, contexts);

            var lines = lines();
            assertTrue(lines.stream().anyMatch(l -> l.contains("┌─ t1") && l.contains("7 passed")));
            assertTrue(lines.stream().anyMatch(l -> l.contains("│ ┌─ t2") && l.contains("1 failed")));

            var setupRow = lines.stream().filter(l -> l.startsWith("fixture.sh::setup")).findFirst().orElseThrow();
            assertTrue(setupRow.strip().endsWith("V X"), setupRow);
            var testRow = lines.stream().filter(l -> l.startsWith("a.sh::test_1")).findFirst().orElseThrow();
            assertTrue(testRow.strip().endsWith("V >"), testRow);
            assertEquals(suite.testCases().size(), lines.stream().filter(l -> l.contains("::")).count());
        }
    }
}
