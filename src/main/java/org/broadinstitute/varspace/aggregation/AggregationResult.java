package org.broadinstitute.varspace.aggregation;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * The value of one aggregation, with the number of rows it was computed over.
 * <p>
 * For numeric actions {@code matched} is the number of numeric cells plus {@code skipped}; the value is absent
 * when no matching cell was numeric. For {@code count} the value equals {@code matched} and nothing is skipped.
 * </p>
 */
public final class AggregationResult {

    private final AggregationAction action;
    private final OptionalDouble value;
    private final int skipped;
    private final int matched;

    public AggregationResult(final AggregationAction action, final OptionalDouble value, final int skipped, final int matched) {
        this.action = Objects.requireNonNull(action);
        this.value = Objects.requireNonNull(value);
        this.skipped = skipped;
        this.matched = matched;
    }

    public AggregationAction getAction() {
        return action;
    }

    /**
     * The aggregated value; empty means NA.
     */
    public OptionalDouble getValue() {
        return value;
    }

    public boolean isNA() {
        return !value.isPresent();
    }

    /**
     * Number of matching rows whose cell was not numeric.
     */
    public int getSkipped() {
        return skipped;
    }

    /**
     * Number of rows matching the filter.
     */
    public int getMatched() {
        return matched;
    }

    /**
     * Number of numeric cells the value was computed from.
     */
    public int getNumericCount() {
        return action == AggregationAction.COUNT ? matched : matched - skipped;
    }

    /**
     * Renders the value as text, or {@code naValue} when absent.
     */
    public String format(final String naValue) {
        if (isNA()) {
            return naValue;
        }
        final double v = value.getAsDouble();
        return v == Math.rint(v) && Math.abs(v) < 1e15 ? Long.toString((long) v) : Double.toString(v);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregationResult)) return false;
        final AggregationResult that = (AggregationResult) o;
        return skipped == that.skipped && matched == that.matched && action == that.action && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, value, skipped, matched);
    }

    @Override
    public String toString() {
        return String.format("%s=%s (matched=%d, skipped=%d)", action, format("NA"), matched, skipped);
    }
}
