package org.broadinstitute.varspace.query;

import org.broadinstitute.varspace.exceptions.UserException;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Cell predicates available to a {@link FilterSpec}.
 * <p>
 * Numeric operators never fail on a cell: a cell that does not parse as a number simply does not match, and
 * neither does any cell when the comparison value itself is not a number.
 * </p>
 */
public enum FilterOperator {

    /** Case-insensitive substring match. */
    CONTAINS("contains") {
        @Override
        Predicate<String> compile(final String value) {
            final String needle = value.toLowerCase(Locale.ROOT);
            return cell -> cell.toLowerCase(Locale.ROOT).contains(needle);
        }
    },

    /** Exact string match. */
    EQUALS("equals") {
        @Override
        Predicate<String> compile(final String value) {
            return value::equals;
        }
    },

    GREATER_THAN("greaterThan") {
        @Override
        Predicate<String> compile(final String value) {
            final Double threshold = NumericCells.parse(value);
            if (threshold == null) {
                return cell -> false;
            }
            return cell -> {
                final Double number = NumericCells.parse(cell);
                return number != null && number > threshold;
            };
        }
    },

    LESS_THAN("lessThan") {
        @Override
        Predicate<String> compile(final String value) {
            final Double threshold = NumericCells.parse(value);
            if (threshold == null) {
                return cell -> false;
            }
            return cell -> {
                final Double number = NumericCells.parse(cell);
                return number != null && number < threshold;
            };
        }
    };

    private final String operatorName;

    FilterOperator(final String operatorName) {
        this.operatorName = operatorName;
    }

    /**
     * Builds the cell predicate for a comparison value.
     */
    abstract Predicate<String> compile(final String value);

    /**
     * The name used by callers, e.g. {@code greaterThan}.
     */
    public String getOperatorName() {
        return operatorName;
    }

    /**
     * @throws UserException.ValidationError if {@code name} is not an operator name.
     */
    public static FilterOperator fromName(final String name) {
        for (final FilterOperator operator : values()) {
            if (operator.operatorName.equals(name)) {
                return operator;
            }
        }
        throw new UserException.ValidationError("unknown filter operator: " + name);
    }
}
