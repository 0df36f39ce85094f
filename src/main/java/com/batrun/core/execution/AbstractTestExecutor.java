package com.batrun.core.execution;

import com.batrun.core.model.TestSuite;
import com.batrun.core.visitor.TestSuiteVisitor;
import com.batrun.driver.TestDriver;
import com.batrun.report.Reporter;

import java.util.List;

/**
 * Stepping helpers shared by the executors.
 */
abstract class AbstractTestExecutor implements TestExecutor {

    /**
     * Runs the next test case of {@code visitor} in {@code context}.
     *
     * @return {@code true} once the walk is over for this context, either because
     *         every case was visited or because the context was aborted
     */
    static boolean step(TestSuiteVisitor visitor, ExecutionContext context,
                        TestDriver testDriver, Reporter reporter) {
        if (context.isAborted()) {
            visitor.abort();
            return true;
        }
        return visitor.visitNext((testCase, role, shouldSkip) ->
                context.run(testDriver, testCase, role, shouldSkip, reporter));
    }

    /**
     * Walks the whole suite for one context, in declaration order.
     */
    static void runToCompletion(TestSuite testSuite, ExecutionContext context,
                                TestDriver testDriver, Reporter reporter) {
        context.begin();
        var visitor = new TestSuiteVisitor(testSuite);
        while (!step(visitor, context, testDriver, reporter)) {
            // one test case per step
        }
        context.finish();
    }

    static void checkContexts(TestSuite testSuite, List<ExecutionContext> executionContexts) {
        for (var context : executionContexts) {
            if (context.testSuite() != testSuite) {
                throw new IllegalArgumentException("Execution context for target " + context.target()
                        + " belongs to " + context.testSuite().path() + ", not " + testSuite.path());
            }
        }
    }
}
