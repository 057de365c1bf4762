package org.broadinstitute.varspace.query;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Pure filter, sort and pagination transforms over an in-memory {@link Table}.
 * <p>
 * All operations work on row indices into the table so that callers can map a view back onto the stored rows;
 * {@link #resolve} is the single path from a filter and a sort to the ordered row positions of a view.
 * </p>
 */
public final class QueryEngine {

    private QueryEngine() {}

    /**
     * Returns the indices, in table order, of the rows matching every condition of {@code filter}.
     *
     * @throws UserException.ValidationError if a condition names a column the table does not have.
     */
    public static List<Integer> filterRows(final Table table, final FilterSpec filter) {
        Utils.nonNull(table, "the table cannot be null");
        Utils.nonNull(filter, "the filter cannot be null");

        final Map<Integer, Predicate<String>> predicates = new LinkedHashMap<>();
        for (final Map.Entry<String, FilterSpec.Condition> entry : filter.conditions().entrySet()) {
            final int column = table.requireColumn(entry.getKey());
            final FilterSpec.Condition condition = entry.getValue();
            final Predicate<String> predicate = condition.getOperator().compile(condition.getValue());
            predicates.merge(column, predicate, Predicate::and);
        }

        final List<Integer> matching = new ArrayList<>();
        for (int i = 0; i < table.rowCount(); i++) {
            final List<String> row = table.row(i);
            boolean keep = true;
            for (final Map.Entry<Integer, Predicate<String>> predicate : predicates.entrySet()) {
                if (!predicate.getValue().test(row.get(predicate.getKey()))) {
                    keep = false;
                    break;
                }
            }
            if (keep) {
                matching.add(i);
            }
        }
        return matching;
    }

    /**
     * Returns a new list with {@code rowIndices} ordered by {@code sort}.
     * <p>
     * Each sort column compares numerically when every non-blank cell of the rows being sorted is numeric and
     * lexicographically otherwise. Blank cells sort last in both directions. Rows equal on every sort column
     * are ordered by their index.
     * </p>
     *
     * @throws UserException.ValidationError if a sort entry names a column the table does not have.
     */
    public static List<Integer> sortRows(final Table table, final List<Integer> rowIndices, final SortSpec sort) {
        Utils.nonNull(table, "the table cannot be null");
        Utils.nonNull(rowIndices, "the row indices cannot be null");
        Utils.nonNull(sort, "the sort cannot be null");

        Comparator<Integer> comparator = null;
        for (final Map.Entry<String, SortDirection> entry : sort.entries().entrySet()) {
            final Comparator<Integer> columnComparator =
                    columnComparator(table, rowIndices, table.requireColumn(entry.getKey()), entry.getValue());
            comparator = comparator == null ? columnComparator : comparator.thenComparing(columnComparator);
        }
        final List<Integer> sorted = new ArrayList<>(rowIndices);
        final Comparator<Integer> byIndex = Comparator.naturalOrder();
        sorted.sort(comparator == null ? byIndex : comparator.thenComparing(byIndex));
        return sorted;
    }

    private static Comparator<Integer> columnComparator(final Table table, final List<Integer> rowIndices,
                                                        final int column, final SortDirection direction) {
        final Map<Integer, Double> numbers = new HashMap<>(rowIndices.size() * 2);
        boolean numeric = true;
        for (final int row : rowIndices) {
            final String cell = table.cell(row, column);
            if (NumericCells.isBlank(cell)) {
                continue;
            }
            final Double value = NumericCells.parse(cell);
            if (value == null) {
                numeric = false;
                break;
            }
            numbers.put(row, value);
        }

        final Comparator<Integer> values;
        if (numeric) {
            values = (a, b) -> Double.compare(numbers.get(a), numbers.get(b));
        } else {
            values = (a, b) -> table.cell(a, column).compareTo(table.cell(b, column));
        }
        final Comparator<Integer> directed = direction == SortDirection.DESC ? values.reversed() : values;

        return (a, b) -> {
            final boolean blankA = NumericCells.isBlank(table.cell(a, column));
            final boolean blankB = NumericCells.isBlank(table.cell(b, column));
            if (blankA || blankB) {
                return Boolean.compare(blankA, blankB);
            }
            return directed.compare(a, b);
        };
    }

    /**
     * Returns the zero-based {@code page} of {@code items}, or an empty list for a page beyond the end.
     *
     * @throws UserException.ValidationError if {@code page} is negative or {@code rowsPerPage} is not positive.
     */
    public static <T> List<T> paginate(final List<T> items, final int page, final int rowsPerPage) {
        Utils.nonNull(items, "the items cannot be null");
        if (page < 0) {
            throw new UserException.ValidationError("page index must not be negative: " + page);
        }
        if (rowsPerPage <= 0) {
            throw new UserException.ValidationError("rows per page must be positive: " + rowsPerPage);
        }
        final long from = (long) page * rowsPerPage;
        if (from >= items.size()) {
            return Collections.emptyList();
        }
        final int to = (int) Math.min(items.size(), from + rowsPerPage);
        return new ArrayList<>(items.subList((int) from, to));
    }

    /**
     * Filters then sorts, returning the ordered row indices of the resulting view.
     */
    public static List<Integer> resolve(final Table table, final FilterSpec filter, final SortSpec sort) {
        return sortRows(table, filterRows(table, filter), sort);
    }
}
