package com.batrun.core.visitor;

import com.batrun.core.model.ShouldSkip;
import com.batrun.core.model.SkipReason;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestCaseRole;
import com.batrun.core.model.TestFile;
import com.batrun.core.model.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Walks the test cases of a {@link TestSuite} one at a time, in canonical order:
 * suite setup, then for every file its setup, test cases and teardown, then
 * suite teardown.
 * <p>
 * The walk is an explicit state machine holding file and case cursors, so a
 * caller can advance several visitors in turn (one per target) without threads.
 *
 * <pre>
 * SUITE_SETUP -> FILE_SETUP -> TEST_CASE -> FILE_TEARDOWN -> SUITE_TEARDOWN -> DONE
 *                   ^            ^    |          |
 *                   |            +----+          |
 *                   +----------------------------+
 * (any state) -> ABORTED
 * </pre>
 *
 * <p>Two skip flags are kept. The suite flag is raised when the suite setup fails
 * and is never cleared. The file flag is raised when a file setup fails and is
 * cleared after that file's teardown. Test cases and file teardowns receive the
 * higher-ranked of the two; file setups and the suite teardown receive the
 * suite flag only.
 */
public class TestSuiteVisitor {

    private static final Logger log = LoggerFactory.getLogger(TestSuiteVisitor.class);

    public enum State {
        SUITE_SETUP,
        FILE_SETUP,
        TEST_CASE,
        FILE_TEARDOWN,
        SUITE_TEARDOWN,
        DONE,
        ABORTED
    }

    private final TestSuite testSuite;
    private final List<TestFile> testFiles;

    private State state = State.SUITE_SETUP;
    private int fileIndex;
    private int caseIndex;
    private ShouldSkip suiteSkip = ShouldSkip.NO;
    private ShouldSkip fileSkip = ShouldSkip.NO;

    public TestSuiteVisitor(TestSuite testSuite) {
        this.testSuite = testSuite;
        this.testFiles = testSuite.testFiles();
    }

    /**
     * Visits every test case of {@code testSuite} in order, ignoring skip advice.
     * Used for read-only walks such as listing or bookkeeping initialisation.
     */
    public static void forEach(TestSuite testSuite, BiConsumer<TestCase, TestCaseRole> consumer) {
        new TestSuiteVisitor(testSuite).visitAll((testCase, role, shouldSkip) -> {
            consumer.accept(testCase, role);
            return true;
        });
    }

    /**
     * Advances the walk until one test case has been handed to {@code callback}
     * or the walk is over.
     *
     * @return {@code true} if the walk is finished and nothing was visited,
     *         {@code false} if exactly one test case was visited
     */
    public boolean visitNext(VisitCallback callback) {
        while (!isFinished()) {
            boolean visited = switch (state) {
                case SUITE_SETUP -> visitSuiteSetup(callback);
                case FILE_SETUP -> visitFileSetup(callback);
                case TEST_CASE -> visitTestCase(callback);
                case FILE_TEARDOWN -> visitFileTeardown(callback);
                case SUITE_TEARDOWN -> visitSuiteTeardown(callback);
                case DONE, ABORTED -> false;
            };
            if (visited) {
                return false;
            }
        }
        return true;
    }

    public void visitAll(VisitCallback callback) {
        while (!visitNext(callback)) {
            // keep stepping
        }
    }

    /**
     * Stops the walk; every later {@link #visitNext} reports completion.
     */
    public void abort() {
        if (state != State.DONE) {
            log.debug("Aborting traversal of {} in state {}", testSuite.path(), state);
            state = State.ABORTED;
        }
    }

    public State state() {
        return state;
    }

    public boolean isFinished() {
        return state == State.DONE || state == State.ABORTED;
    }

    private boolean visitSuiteSetup(VisitCallback callback) {
        state = State.FILE_SETUP;
        fileIndex = 0;
        var setup = testSuite.fixture().setup();
        if (setup == null) {
            return false;
        }
        if (!callback.visit(setup, TestCaseRole.SUITE_SETUP, suiteSkip)) {
            log.debug("Suite setup {} failed, skipping the rest of the suite", setup.id());
            suiteSkip = suiteSkip.withReason(SkipReason.TEST_SUITE_SETUP_ERROR);
        }
        return true;
    }

    private boolean visitFileSetup(VisitCallback callback) {
        if (fileIndex >= testFiles.size()) {
            state = State.SUITE_TEARDOWN;
            return false;
        }
        var testFile = testFiles.get(fileIndex);
        fileSkip = ShouldSkip.NO;
        caseIndex = 0;
        state = State.TEST_CASE;
        var setup = testFile.setup();
        if (setup == null) {
            return false;
        }
        if (!callback.visit(setup, TestCaseRole.FILE_SETUP, suiteSkip)) {
            log.debug("File setup {} failed, skipping {}", setup.id(), testFile.path());
            fileSkip = fileSkip.withReason(SkipReason.TEST_CASE_SETUP_ERROR);
        }
        return true;
    }

    private boolean visitTestCase(VisitCallback callback) {
        var testCases = testFiles.get(fileIndex).testCases();
        if (caseIndex >= testCases.size()) {
            state = State.FILE_TEARDOWN;
            return false;
        }
        var testCase = testCases.get(caseIndex++);
        callback.visit(testCase, TestCaseRole.TEST, suiteSkip.or(fileSkip));
        return true;
    }

    private boolean visitFileTeardown(VisitCallback callback) {
        var testFile = testFiles.get(fileIndex);
        var shouldSkip = suiteSkip.or(fileSkip);
        fileSkip = ShouldSkip.NO;
        fileIndex++;
        state = State.FILE_SETUP;
        var teardown = testFile.teardown();
        if (teardown == null) {
            return false;
        }
        callback.visit(teardown, TestCaseRole.FILE_TEARDOWN, shouldSkip);
        return true;
    }

    private boolean visitSuiteTeardown(VisitCallback callback) {
        state = State.DONE;
        var teardown = testSuite.fixture().teardown();
        if (teardown == null) {
            return false;
        }
        callback.visit(teardown, TestCaseRole.SUITE_TEARDOWN, suiteSkip);
        return true;
    }
}
