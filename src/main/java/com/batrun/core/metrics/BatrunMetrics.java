package com.batrun.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for batrun test execution.
 */
@Service
public class BatrunMetrics {

    private final MeterRegistry registry;

    public BatrunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTestCaseDuration(String target, String status, Duration duration) {
        Timer.builder("batrun.testcase.duration")
                .description("Wall-clock duration of a test case run")
                .tag("target", target)
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    public void recordTestCaseResult(String status) {
        Counter.builder("batrun.testcase.results")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Counts one strategy run over a suite, whatever the number of targets.
     */
    public void recordSuiteRun(String strategy) {
        Counter.builder("batrun.suite.runs")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }
}
