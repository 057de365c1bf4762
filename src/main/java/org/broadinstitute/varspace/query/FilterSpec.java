package org.broadinstitute.varspace.query;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping from column name to a {@link Condition}; all conditions must hold for a row to match.
 */
public final class FilterSpec {

    private static final FilterSpec NONE = new FilterSpec(Collections.emptyMap());

    private final Map<String, Condition> conditions;

    private FilterSpec(final Map<String, Condition> conditions) {
        this.conditions = Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    public static FilterSpec none() {
        return NONE;
    }

    public static FilterSpec where(final String column, final FilterOperator operator, final String value) {
        return NONE.and(column, operator, value);
    }

    public static FilterSpec of(final Map<String, Condition> conditions) {
        Utils.nonNull(conditions, "the filter conditions cannot be null");
        conditions.forEach((column, condition) -> {
            Utils.nonNull(column, "filter column cannot be null");
            Utils.nonNull(condition, "filter condition cannot be null");
        });
        return new FilterSpec(conditions);
    }

    /**
     * Returns a new spec with an additional condition; a condition already present on {@code column} is replaced.
     */
    public FilterSpec and(final String column, final FilterOperator operator, final String value) {
        Utils.nonNull(column, "filter column cannot be null");
        final Map<String, Condition> copy = new LinkedHashMap<>(conditions);
        copy.put(column, new Condition(operator, value));
        return new FilterSpec(copy);
    }

    public Map<String, Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof FilterSpec && conditions.equals(((FilterSpec) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "FilterSpec" + conditions;
    }

    /**
     * An operator and its comparison value.
     */
    public static final class Condition {
        private final FilterOperator operator;
        private final String value;

        public Condition(final FilterOperator operator, final String value) {
            this.operator = Utils.nonNull(operator, "the operator cannot be null");
            this.value = Utils.nonNull(value, "the filter value cannot be null");
        }

        public FilterOperator getOperator() {
            return operator;
        }

        public String getValue() {
            return value;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof Condition)) return false;
            final Condition other = (Condition) o;
            return operator == other.operator && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, value);
        }

        @Override
        public String toString() {
            return operator.getOperatorName() + " " + value;
        }
    }
}
