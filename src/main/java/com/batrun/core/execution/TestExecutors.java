package com.batrun.core.execution;

import com.batrun.core.model.ExecutionStrategy;

/**
 * Maps an {@link ExecutionStrategy} to its executor.
 */
public final class TestExecutors {

    private TestExecutors() {}

    public static TestExecutor forStrategy(ExecutionStrategy strategy, int maxParallel) {
        return switch (strategy) {
            case SEQUENTIAL -> new SequentialExecutor();
            case ROUND_ROBIN -> new RoundRobinExecutor();
            case PARALLEL -> new ParallelExecutor(maxParallel);
        };
    }
}
