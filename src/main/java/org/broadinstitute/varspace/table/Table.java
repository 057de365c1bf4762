package org.broadinstitute.varspace.table;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.tsv.TableColumnCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory variant table: an ordered header of unique column names and rows of text cells positionally
 * aligned to it.
 * <p>
 * Instances are immutable; every row has exactly as many cells as there are columns.
 * </p>
 */
public final class Table {

    private final TableColumnCollection columns;

    private final List<List<String>> rows;

    /**
     * Creates a table, copying the input rows.
     *
     * @throws UserException.ValidationError if the header has repeated names or a row length differs from the header's.
     */
    public Table(final List<String> header, final List<? extends List<String>> rows) {
        Utils.nonNull(header, "the header cannot be null");
        Utils.nonNull(rows, "the rows cannot be null");
        TableColumnCollection.checkNames(header.toArray(new String[0]), UserException.ValidationError::new);
        this.columns = new TableColumnCollection(header);
        final List<List<String>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            copy.add(checkRow(rows.get(i), i));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    private List<String> checkRow(final List<String> row, final int index) {
        Utils.nonNull(row, () -> "row " + index + " is null");
        if (row.size() != columns.columnCount()) {
            throw new UserException.ValidationError(String.format("row %d has %d cells but the header has %d columns",
                    index, row.size(), columns.columnCount()));
        }
        final List<String> copy = new ArrayList<>(row.size());
        for (final String cell : row) {
            copy.add(cell == null ? "" : cell);
        }
        return Collections.unmodifiableList(copy);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    public List<String> header() {
        return columns.names();
    }

    public List<List<String>> rows() {
        return rows;
    }

    public List<String> row(final int index) {
        return rows.get(Utils.validIndex(index, rows.size()));
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.columnCount();
    }

    /**
     * Returns the cell at a row and column index.
     */
    public String cell(final int rowIndex, final int columnIndex) {
        return row(rowIndex).get(Utils.validIndex(columnIndex, columns.columnCount()));
    }

    /**
     * Returns the index of a column, failing if the table has no such column.
     *
     * @throws UserException.ValidationError if there is no column with that name.
     */
    public int requireColumn(final String name) {
        final int index = columns.indexOf(Utils.nonNull(name, "the column name cannot be null"));
        if (index < 0) {
            throw new UserException.ValidationError(String.format("unknown column '%s'; available columns are %s", name, columns));
        }
        return index;
    }

    /**
     * Returns a copy of this table with the rows at the given positions replaced.
     *
     * @param positions original row indices to replace, aligned with {@code replacements}.
     * @param header    the header of the new table; must have as many columns as this one.
     * @param replacements the new rows.
     */
    public Table withRowsReplaced(final List<Integer> positions, final List<String> header, final List<? extends List<String>> replacements) {
        Utils.validateArg(positions.size() == replacements.size(), "positions and replacements must have the same size");
        if (header.size() != columns.columnCount()) {
            throw new UserException.ValidationError(String.format("the submitted header has %d columns but the table has %d",
                    header.size(), columns.columnCount()));
        }
        final List<List<String>> newRows = new ArrayList<>(rows);
        for (int i = 0; i < positions.size(); i++) {
            newRows.set(positions.get(i), replacements.get(i));
        }
        return new Table(header, newRows);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
