package org.broadinstitute.varspace.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.varspace.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes delimited text tables.
 * <p>
 * The columns are passed in the constructor along the output {@link Writer writer}.
 * Extending classes must indicate how a row record of type {@link R} is transcribed to the corresponding
 * data-line in the output by overriding {@link #composeLine(Object, DataLine)}.
 * </p>
 * <p>
 * Example:
 * <pre>
 *         public class ScoreTableWriter extends TableWriter&lt;Score&gt; {
 *
 *             public ScoreTableWriter(final Writer writer) throws IOException {
 *                 super(writer, new TableColumnCollection("gen_pos", "score"), TableFormat.CSV);
 *             }
 *
 *             &#64;Override
 *             protected void composeLine(final Score score, final DataLine dataLine) {
 *                  dataLine.setAll(score.key, String.valueOf(score.value));
 *             }
 *         }
 *     </pre>
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    /**
     * Csv writer use to do the actual writing.
     */
    private final CSVWriter writer;

    /**
     * The table column names.
     */
    private final TableColumnCollection columns;

    /**
     * Whether the header column name line has been written or not.
     */
    private boolean headerWritten = false;

    /**
     * Creates a new table writer given the destination writer and column names.
     *
     * @param writer  the destination writer.
     * @param columns the table column names.
     * @param format  the delimited layout of the output.
     * @throws IllegalArgumentException if any argument is {@code null}.
     * @throws IOException              if one was raised when opening the the destination file for writing.
     */
    public TableWriter(final Writer writer, final TableColumnCollection columns, final TableFormat format) throws IOException {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        Utils.nonNull(format, "The format cannot be null.");
        // the quote doubles as escape character, so embedded quotes are written twice
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                format.getSeparator(), TableUtils.QUOTE_CHARACTER, TableUtils.QUOTE_CHARACTER);
    }

    /**
     * Writes a new record.
     *
     * @param record the record to write.
     * @throws IOException              if it was raised when writing the record.
     * @throws IllegalArgumentException if {@code record} is {@code null} or it is not a valid record
     *                                  as per the implementation of this writer (see {@link #composeLine}).
     */
    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(columns);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
    }

    /**
     * Write all the records in a {@link Iterable} in iteration order.
     */
    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    /**
     * Writes the header if it has not been written already.
     * <p>
     * The header is written automatically before the first record is written or when the writer is closed
     * and no record was written.
     * </p>
     */
    public void writeHeaderIfApplies() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
        }
        headerWritten = true;
    }

    /**
     * Composes the data-line to write into the output to represent a given record.
     *
     * @param record the record to write into the data-line.
     * @param dataLine the destination data-line object.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
