package com.batrun.core.model;

import java.util.Optional;

/**
 * Skip directive attached to each visited test case: either {@link #NO} or
 * "yes" with a {@link SkipReason}.
 * <p>
 * The directive is advisory. The traversal always yields the case; the execution
 * context decides whether the test driver is invoked.
 */
public final class ShouldSkip {

    public static final ShouldSkip NO = new ShouldSkip(null);

    private final SkipReason reason;

    private ShouldSkip(SkipReason reason) {
        this.reason = reason;
    }

    public static ShouldSkip yes(SkipReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("A skip directive needs a reason");
        }
        return new ShouldSkip(reason);
    }

    public boolean isYes() {
        return reason != null;
    }

    public Optional<SkipReason> reason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Returns this directive raised to {@code newReason}, keeping the
     * highest-ranked reason if one is already set.
     */
    public ShouldSkip withReason(SkipReason newReason) {
        if (reason == null) {
            return yes(newReason);
        }
        return yes(SkipReason.max(reason, newReason));
    }

    /**
     * Combines two directives: "no" only if both are "no", otherwise the
     * highest-ranked reason of the two.
     */
    public ShouldSkip or(ShouldSkip other) {
        if (other.reason == null) return this;
        if (reason == null) return other;
        return yes(SkipReason.max(reason, other.reason));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShouldSkip that)) return false;
        return java.util.Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hashCode(reason);
    }

    @Override
    public String toString() {
        return reason == null ? "no" : "yes(" + reason.kind() + ")";
    }
}
