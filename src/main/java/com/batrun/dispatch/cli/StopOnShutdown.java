package com.batrun.dispatch.cli;

import com.batrun.core.runner.TestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * JVM shutdown hook that stops a test run on Ctrl-C or SIGTERM.
 * <p>
 * The hook asks the runner to stop, then holds the shutdown for up to the grace
 * period so the run can finish its case in flight and report its summary.
 * Closing it marks the run as finished and unregisters the hook.
 */
final class StopOnShutdown implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StopOnShutdown.class);

    static final String STOP_REASON = "interrupted";

    private final TestRunner testRunner;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    StopOnShutdown(TestRunner testRunner, Duration grace) {
        this.testRunner = testRunner;
        this.grace = grace;
        this.hook = new Thread(this::stop, "batrun-shutdown");
    }

    StopOnShutdown install() {
        Runtime.getRuntime().addShutdownHook(hook);
        return this;
    }

    void stop() {
        log.debug("Shutdown requested, stopping the test run");
        testRunner.requestStop(STOP_REASON);
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Test run did not stop within {}", grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping the stop hook");
        }
    }
}
