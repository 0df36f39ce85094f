package com.batrun.core.execution;

import com.batrun.core.model.SkipReason;
import com.batrun.core.model.TestCaseStatus;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Execution record of one test case for one target: status, timing, output
 * directory and what the driver reported.
 */
public class TestCaseExecInfo {

    private final Clock clock;
    private volatile TestCaseStatus status = TestCaseStatus.NOT_RUN;
    private volatile TimeInterval duration;
    private volatile SkipReason skipReason;
    private volatile String runnerError;
    private volatile String driverOutput;
    private volatile Path outDir;

    public TestCaseExecInfo() {
        this(Clock.systemUTC());
    }

    public TestCaseExecInfo(Clock clock) {
        this.clock = clock;
    }

    /**
     * Moves to {@code newStatus}. RUNNING opens a fresh time interval, any
     * terminal status closes it.
     *
     * @throws IllegalStateException when asked to go back to NOT_RUN
     */
    public void setStatus(TestCaseStatus newStatus) {
        switch (newStatus) {
            case NOT_RUN -> throw new IllegalStateException("Test case status cannot be reset");
            case RUNNING -> {
                duration = new TimeInterval(clock);
                skipReason = null;
                runnerError = null;
                driverOutput = null;
            }
            default -> {
                if (duration == null) {
                    duration = new TimeInterval(clock);
                }
                duration.stop();
            }
        }
        status = newStatus;
    }

    void markSkipped(SkipReason reason) {
        skipReason = reason;
        setStatus(TestCaseStatus.SKIPPED);
    }

    void markRunnerFailed(String error) {
        runnerError = error;
        setStatus(TestCaseStatus.RUNNER_FAILED);
    }

    void setDriverOutput(String driverOutput) {
        this.driverOutput = driverOutput;
    }

    void setOutDir(Path outDir) {
        this.outDir = outDir;
    }

    public TestCaseStatus status() {
        return status;
    }

    public Optional<SkipReason> skipReason() {
        return Optional.ofNullable(skipReason);
    }

    public Optional<String> runnerError() {
        return Optional.ofNullable(runnerError);
    }

    public Optional<String> driverOutput() {
        return Optional.ofNullable(driverOutput);
    }

    public Optional<Path> outDir() {
        return Optional.ofNullable(outDir);
    }

    /**
     * Returns how long the last run took, empty if the case has not finished.
     */
    public Optional<Duration> duration() {
        var interval = duration;
        return interval == null ? Optional.empty() : interval.elapsed();
    }

    @Override
    public String toString() {
        return "TestCaseExecInfo[" + status + (skipReason != null ? " (" + skipReason + ")" : "") + "]";
    }
}
