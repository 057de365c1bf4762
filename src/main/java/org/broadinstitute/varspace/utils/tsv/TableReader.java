package org.broadinstitute.varspace.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the contents of a delimited text input into records of an arbitrary type {@link R}.
 * <h3>Format description</h3>
 * <p>
 * The first record of the input is the header line: the column names, which must all be different (otherwise a
 * {@link UserException.ValidationError} is thrown). Every other record is a data line and must have exactly as
 * many values as the header line. Blank lines in a multi-column table are ignored.
 * </p>
 * <p>Values can be quoted using {@link TableUtils#QUOTE_CHARACTER}, which becomes necessary when the value contains
 * the separator, a new-line or the quote character itself (written twice within quotes).</p>
 * <h3>Implementing your own reader</h3>
 * <p>
 * Implementations control how instances of {@link R} are instantiated by extending
 * {@link #createRecord(DataLine) createRecord}. They can also override {@link #processColumns} in order to
 * verify the column names, throwing the exception composed by {@link #formatException(String)} if they are not
 * as expected.
 * </p>
 *
 * @param <R> the record type for the reader.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Left at the start of the first column name when a UTF-8 file with a byte-order mark is decoded,
     * as spreadsheet exports often are.
     */
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Name of the input source.
     * <p>It can be {@code null} indicating that no name was provided at construction</p>.
     */
    private final String source;

    /**
     * Input text reader.
     * <p>
     * Keeps track of the last line number read for error reporting purposes.
     * </p>
     */
    private final LineNumberReader reader;

    /**
     * Holds a reference to the column names.
     */
    private TableColumnCollection columns;

    /**
     * Holds a reference to the csvReader object use to read and parse the input
     * into {@link String} arrays.
     */
    private final CSVReader csvReader;

    /**
     * Indicates whether the reader has tried to fetch the next record.
     */
    private boolean nextRecordFetched = false;

    /**
     * Holds a reference to the next record; {@code null} when we reached the end of the source.
     */
    private R nextRecord;

    /**
     * Creates a new table reader given an input {@link Reader}.
     * <p>
     * This operation reads the header line straight away.
     * </p>
     *
     * @param sourceName   name of the source to use in error messages. It can be {@code null}, indicating that is anonymous.
     * @param sourceReader reader to the text to process.
     * @param format       the delimited layout of the text.
     * @throws IllegalArgumentException if {@code sourceReader} or {@code format} is {@code null}.
     * @throws IOException              if is raised when reading from the source.
     */
    protected TableReader(final String sourceName, final Reader sourceReader, final TableFormat format) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        Utils.nonNull(format, "the format cannot be null");

        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, format.getSeparator(), TableUtils.QUOTE_CHARACTER, TableUtils.NO_ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
        this.nextRecordFetched = false;
    }

    /**
     * Process the first line of the input source.
     *
     * @throws IOException                      if an {@link IOException} occurred when reading from the source.
     * @throws UserException.ValidationError    if there is formatting error in the input.
     */
    protected void findAndProcessHeaderLine() throws IOException {
        final String[] line = csvReader.readNext();
        if (line == null) {
            throw formatException("premature end of table: header line not found");
        }
        if (line.length > 0 && line[0].startsWith(BYTE_ORDER_MARK)) {
            line[0] = line[0].substring(BYTE_ORDER_MARK.length());
        }
        TableColumnCollection.checkNames(line, this::formatException);
        columns = new TableColumnCollection(line);
        processColumns(columns);
    }

    /**
     * Composes the exception to be thrown due to a formatting error.
     *
     * @param message custom error message; can be {@code null}.
     * @return never {@code null}.
     */
    protected final UserException.ValidationError formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.ValidationError(String.format("format error at line %d" + explanation, reader.getLineNumber()));
        } else {
            return new UserException.ValidationError(String.format("format error in '%s' at line %d" + explanation, source, reader.getLineNumber()));
        }
    }

    /**
     * Process the header line's column names.
     * <p>
     * Implementations must use {@link #formatException(String)} to create the exception to throw in case
     * there is any formatting issue.
     * </p>
     *
     * @param tableColumns columns found in the input.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    /**
     * Returns the column collection for this reader.
     *
     * @return never {@code null}.
     */
    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isBlankLine(line)) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
            }
            final R result = createRecord(new DataLine(line, columns));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private boolean isBlankLine(final String[] line) {
        return columns.columnCount() > 1 && line.length == 1 && line[0].isEmpty();
    }

    /**
     * Transforms a data-line column values into a record.
     *
     * @param dataLine values corresponding to the column names that was passed earlier to {@link #processColumns(TableColumnCollection)}.
     * @return {@code null} to skip the line, the record otherwise.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    /**
     * Returns an iterator on the remaining records in the input.
     */
    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
                return nextRecord != null;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }
        };
    }

    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    /**
     * Returns an stream on the remaining records in the source.
     * <p>
     * Any {@link IOException} raised when using the stream will be propagated up wrapped in a {@link UncheckedIOException}.
     * </p>
     */
    public Stream<R> stream() {
        return Utils.stream(this);
    }

    /**
     * Read the remaining records into a list. Does not close the reader.
     */
    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }
}
