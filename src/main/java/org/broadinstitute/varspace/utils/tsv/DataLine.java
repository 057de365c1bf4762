package org.broadinstitute.varspace.utils.tsv;

import org.broadinstitute.varspace.utils.Utils;

/**
 * Table data-line string array wrapper.
 * <p>
 * Handed to the record conversion methods {@link TableReader#createRecord(DataLine) TableReader.createRecord}
 * and {@link TableWriter#composeLine TableWriter.composeLine}.
 * </p>
 */
public final class DataLine {

    /**
     * Holds the values for the data line in construction.
     */
    private final String[] values;

    /**
     * Reference to the enclosing table's columns.
     */
    private final TableColumnCollection columns;

    /**
     * Creates a new data-line instance.
     * <p>
     * The value array passed is not copied and will be used directly to store the data-line values.
     * </p>
     *
     * @throws IllegalArgumentException if {@code columns} is {@code null} or its size differs from the values'.
     */
    DataLine(final String[] values, final TableColumnCollection columns) {
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new empty data-line instance.
     */
    public DataLine(final TableColumnCollection columns) {
        this(new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns);
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     *
     * @return never {@code null} and with no {@code null} elements.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    /**
     * Returns a copy of the values of this data-line.
     */
    public String[] toArray() {
        return values.clone();
    }

    public DataLine set(final int index, final String value) {
        Utils.validIndex(index, values.length);
        values[index] = Utils.nonNull(value, "the value cannot be null");
        return this;
    }

    /**
     * Sets all the values of this data-line in column order.
     *
     * @throws IllegalArgumentException if the number of values does not match the number of columns.
     */
    public DataLine setAll(final String... values) {
        Utils.nonNull(values, "the values cannot be null");
        Utils.validateArg(values.length == this.values.length,
                () -> String.format("a row has %d values but the table has %d columns", values.length, this.values.length));
        for (int i = 0; i < values.length; i++) {
            set(i, values[i]);
        }
        return this;
    }
}
