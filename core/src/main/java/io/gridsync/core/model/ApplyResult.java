package io.gridsync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of pushing options (or replaying transient facets) onto a live grid.
 *
 * <p>
 * A single failing key never aborts the pass: it lands in {@link #errors()} while the remaining
 * keys are still attempted. Keys that were deliberately not pushed land in {@link #skipped()}
 * with the reason.
 */
public final class ApplyResult {

    /** Why a key was not pushed to the grid. */
    public enum SkipReason {
        /** The grid already holds a structurally equal value. */
        UNCHANGED,
        /** The option is only honored at grid construction. */
        INITIALIZATION_ONLY,
        /** The option has no canonical definition; it is persisted but never applied. */
        UNKNOWN_OPTION,
        /** The grid was destroyed or detached before the pass started. */
        STALE_INSTANCE
    }

    /**
     * A key the grid rejected.
     *
     * @param key    option name or facet name
     * @param detail the rejection message
     */
    public record ApplyError(String key, String detail) {

        public ApplyError {
            Objects.requireNonNull(key, "key must not be null");
        }
    }

    private static final ApplyResult EMPTY = new ApplyResult(List.of(), Map.of(), List.of(), RefreshPlan.NONE);

    private final List<String> applied;
    private final Map<String, SkipReason> skipped;
    private final List<ApplyError> errors;
    private final RefreshPlan refresh;

    private ApplyResult(
            List<String> applied, Map<String, SkipReason> skipped, List<ApplyError> errors, RefreshPlan refresh) {
        this.applied = applied;
        this.skipped = skipped;
        this.errors = errors;
        this.refresh = refresh;
    }

    /** A result for a pass that had nothing to do. */
    public static ApplyResult empty() {
        return EMPTY;
    }

    /** A result for a pass attempted against a dead grid: every key is skipped. */
    public static ApplyResult staleInstance(Iterable<String> keys) {
        Builder builder = builder();
        keys.forEach(key -> builder.skip(key, SkipReason.STALE_INSTANCE));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Keys actually pushed to the grid, in application order. */
    public List<String> applied() {
        return applied;
    }

    /** Keys not pushed, with the reason. */
    public Map<String, SkipReason> skipped() {
        return skipped;
    }

    /** Keys the grid rejected. */
    public List<ApplyError> errors() {
        return errors;
    }

    /** The redraw scheduled after the pass. */
    public RefreshPlan refresh() {
        return refresh;
    }

    /** True when no key was rejected. */
    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /** True when nothing was pushed to the grid. */
    public boolean isNoOp() {
        return applied.isEmpty() && errors.isEmpty();
    }

    @Override
    public String toString() {
        return "ApplyResult{applied=" + applied + ", skipped=" + skipped + ", errors=" + errors + ", refresh="
                + refresh + "}";
    }

    /** Accumulates the outcome of a pass. */
    public static final class Builder {

        private final List<String> applied = new ArrayList<>();
        private final Map<String, SkipReason> skipped = new LinkedHashMap<>();
        private final List<ApplyError> errors = new ArrayList<>();
        private RefreshPlan refresh = RefreshPlan.NONE;

        Builder() {}

        public Builder applied(String key) {
            applied.add(key);
            return this;
        }

        public Builder skip(String key, SkipReason reason) {
            skipped.put(key, reason);
            return this;
        }

        public Builder error(String key, String detail) {
            errors.add(new ApplyError(key, detail));
            return this;
        }

        public Builder refresh(RefreshPlan plan) {
            this.refresh = Objects.requireNonNull(plan, "plan must not be null");
            return this;
        }

        public boolean hasApplied() {
            return !applied.isEmpty();
        }

        public ApplyResult build() {
            return new ApplyResult(
                    List.copyOf(applied),
                    Collections.unmodifiableMap(new LinkedHashMap<>(skipped)),
                    List.copyOf(errors),
                    refresh);
        }
    }
}
