package com.batrun.report;

import com.batrun.core.error.BatrunException;
import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.execution.TestCaseExecInfo;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestSuite;

import java.time.Duration;
import java.util.List;

/**
 * Forwards every call to each delegate, in order.
 */
public class CompositeReporter implements Reporter {

    private final List<Reporter> delegates;

    public CompositeReporter(List<Reporter> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public CompositeReporter(Reporter... delegates) {
        this(List.of(delegates));
    }

    @Override
    public void noticeDetailed(String message, String details) {
        delegates.forEach(r -> r.noticeDetailed(message, details));
    }

    @Override
    public void infoDetailed(String message, String details) {
        delegates.forEach(r -> r.infoDetailed(message, details));
    }

    @Override
    public void warningDetailed(String message, String details) {
        delegates.forEach(r -> r.warningDetailed(message, details));
    }

    @Override
    public void errorDetailed(String message, String details) {
        delegates.forEach(r -> r.errorDetailed(message, details));
    }

    @Override
    public void errorFrom(BatrunException error) {
        delegates.forEach(r -> r.errorFrom(error));
    }

    @Override
    public void reportTargetList(TestSuite testSuite) {
        delegates.forEach(r -> r.reportTargetList(testSuite));
    }

    @Override
    public void reportTestList(TestSuite testSuite) {
        delegates.forEach(r -> r.reportTestList(testSuite));
    }

    @Override
    public void reportTestSuiteExecutionSummary(TestSuite testSuite, List<ExecutionContext> executionContexts) {
        delegates.forEach(r -> r.reportTestSuiteExecutionSummary(testSuite, executionContexts));
    }

    @Override
    public void reportTotalTime(Duration duration) {
        delegates.forEach(r -> r.reportTotalTime(duration));
    }

    @Override
    public void reportTestCaseExecutionStarted(TestCase testCase, String target, TestCaseExecInfo execInfo) {
        delegates.forEach(r -> r.reportTestCaseExecutionStarted(testCase, target, execInfo));
    }

    @Override
    public void reportTestCaseExecutionResult(TestCase testCase, String target, TestCaseExecInfo execInfo) {
        delegates.forEach(r -> r.reportTestCaseExecutionResult(testCase, target, execInfo));
    }
}
