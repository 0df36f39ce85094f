package com.batrun.core.execution;

import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuiteStatus;
import com.batrun.core.model.TestSuites;
import com.batrun.driver.RecordingTestDriver;
import com.batrun.report.Reporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RoundRobinExecutorTest {

    @TempDir
    Path outRoot;

    private TestSuite suite;
    private RecordingTestDriver driver;
    private Reporter reporter;

    @BeforeEach
    void setUp() {
        suite = TestSuites.sample();
        driver = new RecordingTestDriver(suite);
        reporter = mock(Reporter.class);
    }

    private List<ExecutionContext> contexts(String... targets) {
        return Arrays.stream(targets).map(target -> {
            var context = new ExecutionContext(suite, target);
            context.prepare(outRoot);
            return context;
        }).toList();
    }

    @Test
    @DisplayName("alternates targets one case at a time")
    void interleaves() {
        new RoundRobinExecutor().execute(reporter, driver, suite, contexts("t1", "t2"));

        var calls = driver.calls();
        assertEquals(List.of(
                "t1:fixture.sh::setup", "t2:fixture.sh::setup",
                "t1:a.sh::setup", "t2:a.sh::setup",
                "t1:a.sh::test_1", "t2:a.sh::test_1"), calls.subList(0, 6));
        assertEquals(14, calls.size());
    }

    @Test
    @DisplayName("each target sees the sequential order and every case exactly once")
    void perTargetOrder() {
        new RoundRobinExecutor().execute(reporter, driver, suite, contexts("t1", "t2", "t3"));

        var ids = suite.testCases().stream().map(TestCase::id).toList();
        for (String target : List.of("t1", "t2", "t3")) {
            assertEquals(ids, driver.callsFor(target));
        }
        assertEquals(ids.size() * 3, driver.calls().size());
    }

    @Test
    @DisplayName("no target gets more than one case ahead of another")
    void fairness() {
        new RoundRobinExecutor().execute(reporter, driver, suite, contexts("t1", "t2", "t3"));

        Map<String, Integer> seen = new HashMap<>();
        for (String call : driver.calls()) {
            String target = call.substring(0, call.indexOf(':'));
            seen.merge(target, 1, Integer::sum);
            int max = seen.values().stream().mapToInt(Integer::intValue).max().orElse(0);
            int min = List.of("t1", "t2", "t3").stream().mapToInt(t -> seen.getOrDefault(t, 0)).min().orElse(0);
            assertTrue(max - min <= 1, "unfair schedule at " + call);
        }
    }

    @Test
    @DisplayName("a target whose suite setup failed finishes early, the others go on")
    void earlyFinish() {
        driver.failing("t1", "fixture.sh::setup");
        var contexts = contexts("t1", "t2");

        new RoundRobinExecutor().execute(reporter, driver, suite, contexts);

        assertEquals(List.of("fixture.sh::setup"), driver.callsFor("t1"));
        assertEquals(7, driver.callsFor("t2").size());
        contexts.forEach(c -> assertEquals(TestSuiteStatus.FINISHED, c.status()));
        assertEquals(6, contexts.get(0).statistics().skipped());
    }

    @Test
    @DisplayName("aborting a context mid-run drops it from the rotation")
    void abortMidRun() {
        var contexts = contexts("t1", "t2");
        driver.onRun(call -> {
            if (call.equals("t1:a.sh::setup")) {
                contexts.get(0).abort("stop requested");
            }
        });

        new RoundRobinExecutor().execute(reporter, driver, suite, contexts);

        assertEquals(List.of("fixture.sh::setup", "a.sh::setup"), driver.callsFor("t1"));
        assertEquals(7, driver.callsFor("t2").size());
        assertEquals(TestSuiteStatus.ABORTED, contexts.get(0).status());
        assertEquals(TestSuiteStatus.FINISHED, contexts.get(1).status());
    }

    @Test
    void noContextsIsNoop() {
        new RoundRobinExecutor().execute(reporter, driver, suite, List.of());
        assertTrue(driver.calls().isEmpty());
    }
}
