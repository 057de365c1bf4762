package org.broadinstitute.varspace.query;

import com.google.common.primitives.Doubles;

/**
 * Numeric interpretation of text cells.
 * <p>
 * A cell is numeric when, once trimmed, it parses as a finite decimal number. Blank cells, {@code NaN} and
 * infinities are not numeric.
 * </p>
 */
public final class NumericCells {

    private NumericCells() {}

    /**
     * Parses a cell.
     *
     * @return {@code null} if the cell is not numeric.
     */
    public static Double parse(final String cell) {
        if (cell == null) {
            return null;
        }
        final String trimmed = cell.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        final Double value = Doubles.tryParse(trimmed);
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }

    public static boolean isNumeric(final String cell) {
        return parse(cell) != null;
    }

    public static boolean isBlank(final String cell) {
        return cell == null || cell.trim().isEmpty();
    }
}
