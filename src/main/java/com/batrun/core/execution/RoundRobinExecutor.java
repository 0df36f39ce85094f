package com.batrun.core.execution;

import com.batrun.core.logging.MdcContext;
import com.batrun.core.model.TestSuite;
import com.batrun.core.visitor.TestSuiteVisitor;
import com.batrun.driver.TestDriver;
import com.batrun.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Runs one test case per target in turn, on the calling thread.
 * <p>
 * Each target keeps its own visitor. The pending targets form a queue: the head
 * is stepped once and goes back to the tail unless its walk is over. Within a
 * target the order is the sequential one, and no target gets more than one case
 * ahead of another.
 */
public class RoundRobinExecutor extends AbstractTestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RoundRobinExecutor.class);

    private record Lane(ExecutionContext context, TestSuiteVisitor visitor) {}

    @Override
    public void execute(Reporter reporter, TestDriver testDriver, TestSuite testSuite,
                        List<ExecutionContext> executionContexts) {
        checkContexts(testSuite, executionContexts);
        var queue = new ArrayDeque<Lane>();
        for (var context : executionContexts) {
            context.begin();
            queue.addLast(new Lane(context, new TestSuiteVisitor(testSuite)));
        }
        log.info("Running {} round-robin over {} targets", testSuite.path(), queue.size());

        while (!queue.isEmpty()) {
            var lane = queue.pollFirst();
            boolean done;
            MdcContext.setTarget(testSuite.path().toString(), lane.context().target());
            try {
                done = step(lane.visitor(), lane.context(), testDriver, reporter);
            } finally {
                MdcContext.clear();
            }
            if (done) {
                lane.context().finish();
                log.debug("Target {} done, {} remaining", lane.context().target(), queue.size());
            } else {
                queue.addLast(lane);
            }
        }
    }
}
