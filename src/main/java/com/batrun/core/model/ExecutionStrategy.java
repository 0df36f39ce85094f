package com.batrun.core.model;

/**
 * Strategy for interleaving the test cases of several targets.
 * <p>
 * SEQUENTIAL: all test cases of a target before passing to the next target.
 * ROUND_ROBIN: one test case per target in turn, on a single thread.
 * PARALLEL: every target runs its own sequential walk on its own thread.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    ROUND_ROBIN,
    PARALLEL
}
