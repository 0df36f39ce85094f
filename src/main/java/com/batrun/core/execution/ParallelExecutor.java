package com.batrun.core.execution;

import com.batrun.core.logging.MdcContext;
import com.batrun.core.model.TestSuite;
import com.batrun.driver.TestDriver;
import com.batrun.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every target's sequential walk on its own worker thread.
 * <p>
 * Workers share only the read-only suite model and the driver; each owns its
 * context and visitor, so the join at the end is the only synchronisation point.
 * The pool is bounded by {@code maxParallel}; zero or less means one thread per
 * target.
 * <p>
 * Interrupting the calling thread aborts every context, interrupts the workers
 * and waits up to the termination timeout for them to return, so contexts are
 * no longer mutated once {@link #execute} has returned.
 */
public class ParallelExecutor extends AbstractTestExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    static final Duration DEFAULT_TERMINATION_TIMEOUT = Duration.ofSeconds(30);

    private final int maxParallel;
    private final Duration terminationTimeout;

    public ParallelExecutor() {
        this(0);
    }

    public ParallelExecutor(int maxParallel) {
        this(maxParallel, DEFAULT_TERMINATION_TIMEOUT);
    }

    public ParallelExecutor(int maxParallel, Duration terminationTimeout) {
        this.maxParallel = maxParallel;
        this.terminationTimeout = terminationTimeout;
    }

    @Override
    public void execute(Reporter reporter, TestDriver testDriver, TestSuite testSuite,
                        List<ExecutionContext> executionContexts) {
        checkContexts(testSuite, executionContexts);
        if (executionContexts.isEmpty()) {
            return;
        }
        int threads = maxParallel <= 0
                ? executionContexts.size()
                : Math.min(maxParallel, executionContexts.size());
        log.info("Running {} in parallel over {} targets ({} workers)",
                testSuite.path(), executionContexts.size(), threads);

        var threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "batrun-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        var futures = new ArrayList<Future<?>>();
        try {
            for (var context : executionContexts) {
                futures.add(pool.submit(() -> {
                    MdcContext.setTarget(testSuite.path().toString(), context.target());
                    try {
                        runToCompletion(testSuite, context, testDriver, reporter);
                    } finally {
                        MdcContext.clear();
                    }
                }));
            }
            pool.shutdown();
            awaitAll(futures, executionContexts, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    private void awaitAll(List<Future<?>> futures, List<ExecutionContext> executionContexts,
                          ExecutorService pool) {
        RuntimeException failure = null;
        for (int i = 0; i < futures.size(); i++) {
            var context = executionContexts.get(i);
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for workers, cancelling remaining executions");
                executionContexts.forEach(c -> c.abort("interrupted"));
                pool.shutdownNow();
                awaitTermination(pool);
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                log.error("Execution worker for target {} failed", context.target(), e.getCause());
                context.abort("worker failed: " + e.getCause());
                if (failure == null) {
                    failure = new IllegalStateException(
                            "Execution worker for target " + context.target() + " failed", e.getCause());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void awaitTermination(ExecutorService pool) {
        long deadline = System.nanoTime() + terminationTimeout.toNanos();
        while (!pool.isTerminated()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Workers still running {} after cancellation", terminationTimeout);
                return;
            }
            try {
                pool.awaitTermination(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                log.debug("Interrupted again while awaiting worker termination");
            }
        }
    }
}
