package org.broadinstitute.varspace.utils.tsv;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Delimited text layouts a workspace table file can be stored in.
 * <p>
 * The layout is always chosen from the file name extension, never sniffed from the content.
 * </p>
 */
public enum TableFormat {

    CSV(".csv", ','),
    TSV(".tsv", '\t');

    private final String extension;

    private final char separator;

    TableFormat(final String extension, final char separator) {
        this.extension = extension;
        this.separator = separator;
    }

    /**
     * File name extension including the leading dot, e.g. {@code ".csv"}.
     */
    public String getExtension() {
        return extension;
    }

    public char getSeparator() {
        return separator;
    }

    /**
     * Finds the format for a file name by its extension (case-insensitive).
     *
     * @param fileName the file name or path, never {@code null}.
     * @return empty if the extension is not a known table format.
     */
    public static Optional<TableFormat> fromFileName(final String fileName) {
        Utils.nonNull(fileName, "the file name cannot be null");
        final String lowerCase = fileName.toLowerCase(Locale.ROOT);
        return Stream.of(values()).filter(f -> lowerCase.endsWith(f.extension)).findFirst();
    }
}
