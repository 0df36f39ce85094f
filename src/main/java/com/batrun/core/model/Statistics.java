package com.batrun.core.model;

/**
 * Outcome counts of one target's execution, derived from its test case statuses.
 * Dry-run cases count as skipped.
 */
public record Statistics(
    int passed,
    int failed,
    int runnerFailed,
    int skipped
) {

    public static Statistics of(Iterable<TestCaseStatus> statuses) {
        int passed = 0;
        int failed = 0;
        int runnerFailed = 0;
        int skipped = 0;
        for (var status : statuses) {
            switch (status) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case RUNNER_FAILED -> runnerFailed++;
                case SKIPPED, DRY_RUN -> skipped++;
                default -> { }
            }
        }
        return new Statistics(passed, failed, runnerFailed, skipped);
    }

    public int total() {
        return passed + failed + runnerFailed + skipped;
    }

    public boolean hasFailures() {
        return failed > 0 || runnerFailed > 0;
    }
}
