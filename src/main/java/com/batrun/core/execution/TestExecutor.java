package com.batrun.core.execution;

import com.batrun.core.model.TestSuite;
import com.batrun.driver.TestDriver;
import com.batrun.report.Reporter;

import java.util.List;

/**
 * Drives the execution of a test suite for several targets, one
 * {@link ExecutionContext} per target, following an interleaving policy.
 * <p>
 * On return every context has been walked to completion (or stopped through
 * {@link ExecutionContext#abort}); test case and runner failures never stop the
 * walk of other cases, files or targets.
 */
public interface TestExecutor {

    void execute(Reporter reporter, TestDriver testDriver, TestSuite testSuite,
                 List<ExecutionContext> executionContexts);
}
