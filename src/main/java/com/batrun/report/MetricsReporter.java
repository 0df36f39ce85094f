package com.batrun.report;

import com.batrun.core.execution.ExecutionContext;
import com.batrun.core.execution.TestCaseExecInfo;
import com.batrun.core.metrics.BatrunMetrics;
import com.batrun.core.model.ExecutionStrategy;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestSuite;

import java.time.Duration;
import java.util.List;

/**
 * Feeds test case outcomes and suite runs into {@link BatrunMetrics}. Messages
 * and listings are ignored.
 */
public class MetricsReporter implements Reporter {

    private final BatrunMetrics metrics;
    private final ExecutionStrategy strategy;

    public MetricsReporter(BatrunMetrics metrics, ExecutionStrategy strategy) {
        this.metrics = metrics;
        this.strategy = strategy;
    }

    @Override
    public void reportTestCaseExecutionResult(TestCase testCase, String target, TestCaseExecInfo execInfo) {
        String status = execInfo.status().name();
        metrics.recordTestCaseResult(status);
        execInfo.duration().ifPresent(d -> metrics.recordTestCaseDuration(target, status, d));
    }

    @Override
    public void noticeDetailed(String message, String details) {
    }

    @Override
    public void infoDetailed(String message, String details) {
    }

    @Override
    public void warningDetailed(String message, String details) {
    }

    @Override
    public void errorDetailed(String message, String details) {
    }

    @Override
    public void reportTargetList(TestSuite testSuite) {
    }

    @Override
    public void reportTestList(TestSuite testSuite) {
    }

    @Override
    public void reportTestSuiteExecutionSummary(TestSuite testSuite, List<ExecutionContext> executionContexts) {
        metrics.recordSuiteRun(strategy.name());
    }

    @Override
    public void reportTotalTime(Duration duration) {
    }
}
