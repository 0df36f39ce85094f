package com.batrun.core.model;

import java.util.Objects;

/**
 * Why a test case should be treated as skipped rather than run.
 * <p>
 * Reasons are ranked by {@link Kind}: when several apply to the same case the
 * highest-ranked one wins and is the one reported.
 *
 * @param kind    the ranked kind of reason
 * @param message explanation supplied by the driver or the engine; only set for
 *                {@link Kind#TEST_CASE_SPECIFIC}
 */
public record SkipReason(Kind kind, String message) implements Comparable<SkipReason> {

    /** Ordered from the lowest to the highest precedence. */
    public enum Kind {
        TEST_CASE_SPECIFIC,
        TEST_CASE_SETUP_ERROR,
        TEST_SUITE_SETUP_ERROR
    }

    public static final SkipReason TEST_CASE_SETUP_ERROR = new SkipReason(Kind.TEST_CASE_SETUP_ERROR, null);
    public static final SkipReason TEST_SUITE_SETUP_ERROR = new SkipReason(Kind.TEST_SUITE_SETUP_ERROR, null);

    public SkipReason {
        Objects.requireNonNull(kind, "kind");
    }

    public static SkipReason testCaseSpecific(String message) {
        return new SkipReason(Kind.TEST_CASE_SPECIFIC, message);
    }

    public static SkipReason max(SkipReason a, SkipReason b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(SkipReason other) {
        return kind.compareTo(other.kind);
    }

    public String describe() {
        return switch (kind) {
            case TEST_CASE_SPECIFIC -> message != null && !message.isBlank() ? message : "skipped by test case";
            case TEST_CASE_SETUP_ERROR -> "test case setup failed";
            case TEST_SUITE_SETUP_ERROR -> "test suite setup failed";
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}
