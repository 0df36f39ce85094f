package com.batrun.core.runner;

import com.batrun.core.model.ExecutionStrategy;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolved options of one batrun invocation.
 *
 * @param testSuiteDirs          suite directories to load
 * @param outDir                 output root
 * @param targets                requested targets; empty selects every target of the suite config
 * @param strategy               how test cases of several targets are interleaved
 * @param maxParallel            worker cap for {@link ExecutionStrategy#PARALLEL}, 0 for one per target
 * @param dryRun                 walk every case but execute nothing
 * @param testFilter             regex on test case ids, nullable
 * @param runTeardownWhenSkipped still execute teardown cases under a skip flag
 * @param debug                  extra console output
 * @param matrixSummary          print the summary as a matrix
 */
public record Settings(
    List<Path> testSuiteDirs,
    Path outDir,
    List<String> targets,
    ExecutionStrategy strategy,
    int maxParallel,
    boolean dryRun,
    Pattern testFilter,
    boolean runTeardownWhenSkipped,
    boolean debug,
    boolean matrixSummary
) {
    public Settings {
        testSuiteDirs = testSuiteDirs != null ? List.copyOf(testSuiteDirs) : List.of();
        targets = targets != null ? List.copyOf(targets) : List.of();
        if (outDir == null) outDir = Path.of("out");
        if (strategy == null) strategy = ExecutionStrategy.ROUND_ROBIN;
        if (maxParallel < 0) {
            throw new IllegalArgumentException("maxParallel must be >= 0, got " + maxParallel);
        }
    }
}
