package com.batrun.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A single runnable unit of a test suite, identified by the file that declares it
 * and its name within that file.
 * <p>
 * Carries no runtime state; execution state is kept by the execution context and
 * keyed by this value.
 *
 * @param path file path relative to the test suite directory
 * @param name name of the test case within the file (e.g. a function name)
 */
public record TestCase(Path path, String name) {

    public TestCase {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
    }

    public static TestCase of(String path, String name) {
        return new TestCase(Path.of(path), name);
    }

    /**
     * Returns the printable identifier {@code path::name}.
     */
    public String id() {
        return path + "::" + name;
    }

    @Override
    public String toString() {
        return id();
    }
}
