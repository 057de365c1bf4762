package org.broadinstitute.varspace.utils.tsv;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Represents the ordered list of a table's column names.
 * <p>
 * Names are unique; the first column has index 0.
 * </p>
 */
public final class TableColumnCollection {

    /**
     * List of column names sorted by their index.
     */
    private final List<String> names;

    /**
     * Map from column name to its index.
     */
    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column names collection.
     * <p>
     * The new instance will have its own copy of the input names.
     * </p>
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name list
     *                                  as determined by {@link #checkNames checkNames}.
     */
    public TableColumnCollection(final List<String> names) {
        this(Utils.nonNull(names, "the names cannot be null").toArray(new String[0]));
    }

    /**
     * Creates a new table-column names collection.
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name array
     *                                  as determined by {@link #checkNames checkNames}.
     */
    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, a unmodifiable view to this collection column names.
     */
    public List<String> names() {
        return names;
    }

    /**
     * Returns the name of a column by its index.
     *
     * @throws IllegalArgumentException if {@code index} is not a valid column index.
     */
    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * Returns the index of a column by its name.
     *
     * @param name the query column name.
     * @return {@code -1} if there is not such a column, 0 or greater otherwise.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    /**
     * Check whether there is such a column by name.
     *
     * @throws IllegalArgumentException if {@code name} is {@code null}.
     */
    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    /**
     * Returns the number of columns.
     */
    public int columnCount() {
        return names.size();
    }

    /**
     * Checks that a column name array is valid.
     * <p>
     * Assuming that it is null-value free, a column name array is invalid if it has length 0 or contains repeats.
     * When the input array is invalid, an exception is thrown using the exception factory function provided;
     * the message passed to the factory explains why.
     * </p>
     *
     * @throws IllegalArgumentException if {@code columnNames} is {@code null}, or it contains any {@code null}, or
     *                                  {@code exceptionFactory} is {@code null} or returns a {@code null}.
     * @return never {@code null}, the same reference as the input column name array {@code columnNames}.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw Utils.nonNull(exceptionFactory.apply("there must be at least one column"));
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i], "no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw Utils.nonNull(exceptionFactory.apply("more than one column have the same name: " + columnNames[i]), "exception factory produces null exceptions");
            }
        }
        return columnNames;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof TableColumnCollection)) return false;
        return names.equals(((TableColumnCollection) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
