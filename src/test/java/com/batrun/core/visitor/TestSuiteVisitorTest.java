package com.batrun.core.visitor;

import com.batrun.core.model.ShouldSkip;
import com.batrun.core.model.SkipReason;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestCaseRole;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuites;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TestSuiteVisitorTest {

    private record Visit(String id, TestCaseRole role, ShouldSkip shouldSkip) {}

    /**
     * Callback recording every visit and failing the cases whose id is listed.
     */
    private static final class Recorder implements VisitCallback {
        final List<Visit> visits = new ArrayList<>();
        final Set<String> failing;

        Recorder(String... failing) {
            this.failing = Set.of(failing);
        }

        @Override
        public boolean visit(TestCase testCase, TestCaseRole role, ShouldSkip shouldSkip) {
            visits.add(new Visit(testCase.id(), role, shouldSkip));
            return !failing.contains(testCase.id());
        }

        List<String> ids() {
            return visits.stream().map(Visit::id).toList();
        }

        ShouldSkip skipOf(String id) {
            return visits.stream().filter(v -> v.id().equals(id)).findFirst().orElseThrow().shouldSkip();
        }
    }

    private static final ShouldSkip SUITE_SKIP = ShouldSkip.yes(SkipReason.TEST_SUITE_SETUP_ERROR);
    private static final ShouldSkip FILE_SKIP = ShouldSkip.yes(SkipReason.TEST_CASE_SETUP_ERROR);

    @Nested
    @DisplayName("Traversal order")
    class Order {

        @Test
        @DisplayName("suite setup, each file's setup/tests/teardown, suite teardown")
        void canonicalOrder() {
            var recorder = new Recorder();
            new TestSuiteVisitor(TestSuites.sample()).visitAll(recorder);

            assertEquals(List.of(
                    "fixture.sh::setup",
                    "a.sh::setup", "a.sh::test_1", "a.sh::test_2", "a.sh::teardown",
                    "b.sh::test_3",
                    "fixture.sh::teardown"), recorder.ids());
            assertEquals(List.of(
                    TestCaseRole.SUITE_SETUP,
                    TestCaseRole.FILE_SETUP, TestCaseRole.TEST, TestCaseRole.TEST, TestCaseRole.FILE_TEARDOWN,
                    TestCaseRole.TEST,
                    TestCaseRole.SUITE_TEARDOWN), recorder.visits.stream().map(Visit::role).toList());
            assertTrue(recorder.visits.stream().allMatch(v -> v.shouldSkip().equals(ShouldSkip.NO)));
        }

        @Test
        @DisplayName("visitNext visits exactly one case per call, then reports completion")
        void oneCasePerStep() {
            var suite = TestSuites.sample();
            var visitor = new TestSuiteVisitor(suite);
            var recorder = new Recorder();

            int steps = 0;
            while (!visitor.visitNext(recorder)) {
                steps++;
                assertEquals(steps, recorder.visits.size());
            }
            assertEquals(suite.testCases().size(), steps);
            assertEquals(TestSuiteVisitor.State.DONE, visitor.state());

            assertTrue(visitor.visitNext(recorder));
            assertEquals(steps, recorder.visits.size());
        }

        @Test
        @DisplayName("a suite without any case is done on the first step")
        void emptySuite() {
            var visitor = new TestSuiteVisitor(TestSuites.builder().build());
            var recorder = new Recorder();

            assertTrue(visitor.visitNext(recorder));
            assertTrue(recorder.visits.isEmpty());
            assertTrue(visitor.isFinished());
        }

        @Test
        @DisplayName("missing fixtures and empty files are stepped over")
        void missingFixtures() {
            TestSuite suite = TestSuites.builder()
                    .file("a.sh", false, false)
                    .file("b.sh", false, true, "test_1")
                    .file("c.sh", true, false)
                    .build();
            var recorder = new Recorder();
            new TestSuiteVisitor(suite).visitAll(recorder);

            assertEquals(List.of("b.sh::test_1", "b.sh::teardown", "c.sh::setup"), recorder.ids());
        }

        @Test
        @DisplayName("forEach yields every case with its role")
        void forEachVisitsAll() {
            var roles = new ArrayList<TestCaseRole>();
            TestSuiteVisitor.forEach(TestSuites.sample(), (testCase, role) -> roles.add(role));
            assertEquals(7, roles.size());
            assertEquals(TestCaseRole.SUITE_SETUP, roles.get(0));
            assertEquals(TestCaseRole.SUITE_TEARDOWN, roles.get(6));
        }
    }

    @Nested
    @DisplayName("Skip propagation")
    class SkipPropagation {

        @Test
        @DisplayName("failed suite setup marks every later case, teardowns included")
        void suiteSetupFailure() {
            var recorder = new Recorder("fixture.sh::setup");
            new TestSuiteVisitor(TestSuites.sample()).visitAll(recorder);

            assertEquals(7, recorder.visits.size());
            assertEquals(ShouldSkip.NO, recorder.skipOf("fixture.sh::setup"));
            recorder.visits.stream().skip(1).forEach(v -> assertEquals(SUITE_SKIP, v.shouldSkip(), v.id()));
        }

        @Test
        @DisplayName("failed file setup marks that file's tests and teardown only")
        void fileSetupFailure() {
            var recorder = new Recorder("a.sh::setup");
            new TestSuiteVisitor(TestSuites.sample()).visitAll(recorder);

            assertEquals(ShouldSkip.NO, recorder.skipOf("a.sh::setup"));
            assertEquals(FILE_SKIP, recorder.skipOf("a.sh::test_1"));
            assertEquals(FILE_SKIP, recorder.skipOf("a.sh::test_2"));
            assertEquals(FILE_SKIP, recorder.skipOf("a.sh::teardown"));
            assertEquals(ShouldSkip.NO, recorder.skipOf("b.sh::test_3"));
            assertEquals(ShouldSkip.NO, recorder.skipOf("fixture.sh::teardown"));
        }

        @Test
        @DisplayName("suite reason outranks file reason")
        void suiteReasonWins() {
            var recorder = new Recorder("fixture.sh::setup", "a.sh::setup");
            new TestSuiteVisitor(TestSuites.sample()).visitAll(recorder);

            assertEquals(SUITE_SKIP, recorder.skipOf("a.sh::setup"));
            assertEquals(SUITE_SKIP, recorder.skipOf("a.sh::test_1"));
            assertEquals(SUITE_SKIP, recorder.skipOf("a.sh::teardown"));
        }

        @Test
        @DisplayName("failing tests and teardowns do not raise any skip flag")
        void testFailuresDoNotPropagate() {
            var recorder = new Recorder("a.sh::test_1", "a.sh::teardown");
            new TestSuiteVisitor(TestSuites.sample()).visitAll(recorder);

            assertTrue(recorder.visits.stream().allMatch(v -> v.shouldSkip().equals(ShouldSkip.NO)));
        }

        @Test
        @DisplayName("file skip flag is reset for the next file")
        void fileFlagReset() {
            TestSuite suite = TestSuites.builder()
                    .file("a.sh", true, false, "test_1")
                    .file("b.sh", true, false, "test_2")
                    .build();
            var recorder = new Recorder("a.sh::setup");
            new TestSuiteVisitor(suite).visitAll(recorder);

            assertEquals(FILE_SKIP, recorder.skipOf("a.sh::test_1"));
            assertEquals(ShouldSkip.NO, recorder.skipOf("b.sh::setup"));
            assertEquals(ShouldSkip.NO, recorder.skipOf("b.sh::test_2"));
        }
    }

    @Nested
    @DisplayName("Abort")
    class Abort {

        @Test
        @DisplayName("abort stops the walk for good")
        void abortStopsWalk() {
            var visitor = new TestSuiteVisitor(TestSuites.sample());
            var recorder = new Recorder();
            assertFalse(visitor.visitNext(recorder));
            assertFalse(visitor.visitNext(recorder));

            visitor.abort();

            assertEquals(TestSuiteVisitor.State.ABORTED, visitor.state());
            assertTrue(visitor.visitNext(recorder));
            assertEquals(2, recorder.visits.size());
        }

        @Test
        @DisplayName("abort after completion keeps DONE")
        void abortAfterDone() {
            var visitor = new TestSuiteVisitor(TestSuites.sample());
            visitor.visitAll(new Recorder());
            visitor.abort();
            assertEquals(TestSuiteVisitor.State.DONE, visitor.state());
        }
    }
}
