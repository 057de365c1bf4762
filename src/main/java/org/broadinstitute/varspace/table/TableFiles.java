package org.broadinstitute.varspace.table;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.tsv.TableFormat;
import org.broadinstitute.varspace.utils.tsv.TableReader;
import org.broadinstitute.varspace.utils.tsv.TableUtils;
import org.broadinstitute.varspace.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Whole-file conversion between table files and {@link Table}s.
 */
public final class TableFiles {

    private TableFiles() {}

    /**
     * Reads a whole table file.
     *
     * @param path   the file to read.
     * @param format the delimited layout of the file.
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     * @throws UserException.ValidationError      if the content is malformed.
     */
    public static Table read(final Path path, final TableFormat format) {
        Utils.nonNull(path, "the path cannot be null");
        try (final Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(path.toString(), in, format);
        } catch (final IOException | UncheckedIOException ex) {
            throw new UserException.CouldNotReadInputFile(path, ex);
        }
    }

    /**
     * Reads a whole table from a text reader; the reader is not closed.
     */
    public static Table read(final String sourceName, final Reader in, final TableFormat format) throws IOException {
        final TableReader<List<String>> reader = TableUtils.reader(sourceName, in, format,
                (columns, formatExceptionFactory) -> dataLine -> Arrays.asList(dataLine.toArray()));
        final List<List<String>> rows = reader.toList();
        return new Table(reader.columns().names(), rows);
    }

    /**
     * Writes a whole table to a text writer; the writer is closed.
     */
    public static void write(final Writer out, final Table table, final TableFormat format) throws IOException {
        Utils.nonNull(table, "the table cannot be null");
        try (final TableWriter<List<String>> writer = TableUtils.writer(out, table.columns(), format,
                (row, dataLine) -> dataLine.setAll(row.toArray(new String[0])))) {
            writer.writeAllRecords(table.rows());
        }
    }
}
