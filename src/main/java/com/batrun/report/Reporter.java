package com.batrun.report;

import com.batrun.core.error.BatrunException;
import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.execution.TestCaseExecInfo;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestSuite;

import java.time.Duration;
import java.util.List;

/**
 * Presentation of messages and execution results.
 * <p>
 * The execution engine calls {@link #reportTestCaseExecutionStarted} before
 * attempting a case and {@link #reportTestCaseExecutionResult} exactly once after
 * its outcome is final, skipped cases included. Under the parallel strategy these
 * hooks are called from several worker threads.
 */
public interface Reporter {

    default void notice(String message) {
        noticeDetailed(message, "");
    }

    default void info(String message) {
        infoDetailed(message, "");
    }

    default void warning(String message) {
        warningDetailed(message, "");
    }

    default void error(String message) {
        errorDetailed(message, "");
    }

    void noticeDetailed(String message, String details);

    void infoDetailed(String message, String details);

    void warningDetailed(String message, String details);

    void errorDetailed(String message, String details);

    default void errorFrom(BatrunException error) {
        errorDetailed(error.getMessage(), error.getDetails());
    }

    void reportTargetList(TestSuite testSuite);

    void reportTestList(TestSuite testSuite);

    void reportTestSuiteExecutionSummary(TestSuite testSuite, List<ExecutionContext> executionContexts);

    void reportTotalTime(Duration duration);

    default void reportTestCaseExecutionStarted(TestCase testCase, String target, TestCaseExecInfo execInfo) {
    }

    void reportTestCaseExecutionResult(TestCase testCase, String target, TestCaseExecInfo execInfo);
}
