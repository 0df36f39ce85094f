package com.batrun.core.execution;

import com.batrun.core.logging.MdcContext;
import com.batrun.core.model.TestSuite;
import com.batrun.driver.TestDriver;
import com.batrun.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs all test cases of a target before passing to the next target.
 */
public class SequentialExecutor extends AbstractTestExecutor {

    private static final Logger log = LoggerFactory.getLogger(SequentialExecutor.class);

    @Override
    public void execute(Reporter reporter, TestDriver testDriver, TestSuite testSuite,
                        List<ExecutionContext> executionContexts) {
        checkContexts(testSuite, executionContexts);
        for (var context : executionContexts) {
            log.info("Running {} for target {}", testSuite.path(), context.target());
            MdcContext.setTarget(testSuite.path().toString(), context.target());
            try {
                runToCompletion(testSuite, context, testDriver, reporter);
            } finally {
                MdcContext.clear();
            }
        }
    }
}
