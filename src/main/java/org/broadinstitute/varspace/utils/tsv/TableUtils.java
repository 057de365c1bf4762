package org.broadinstitute.varspace.utils.tsv;

import org.broadinstitute.varspace.utils.Utils;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Common constants and factories for table readers and writers.
 */
public final class TableUtils {

    /**
     * Quote character.
     * <p>
     * Character used to quote table values that contain special characters. A quote within a quoted value
     * is written twice.
     * </p>
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Character opencsv uses to mean "no escape character" when parsing.
     */
    public static final char NO_ESCAPE_CHARACTER = '\u0000';

    private TableUtils() {
        throw new UnsupportedOperationException();
    }

    /**
     * Creates a new table reader given an record extractor factory based from the columns found in the input.
     * <p>
     * The record extractor factory takes the {@link TableColumnCollection} found in the input and
     * an exception factory to be used in order to compose the exception to throw when there is a formatting error.
     * It must return a function that maps {@link DataLine} instances into record instances.
     * </p>
     *
     * @param sourceName             name of the input used in error messages.
     * @param sourceReader           the input text.
     * @param format                 the delimited layout of the input.
     * @param recordExtractorFactory the record extractor function factory.
     * @param <R>                    the end record type.
     * @return never {@code null}.
     * @throws IOException if any took place while reading the header line.
     */
    public static <R> TableReader<R> reader(final String sourceName,
                                            final Reader sourceReader,
                                            final TableFormat format,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory, "the record extractor factory cannot be null");
        return new TableReader<R>(sourceName, sourceReader, format) {
            private Function<DataLine, R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns, this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table writer given the destination writer, columns and the record data-line composer.
     *
     * @param writer    the destination writer.
     * @param columns   the output table columns.
     * @param format    the delimited layout of the output.
     * @param dataLineComposer composes the data-line for each record.
     * @param <R>       the record type.
     * @return never {@code null}.
     * @throws IOException if one was raised when opening the destination.
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns,
                                            final TableFormat format,
                                            final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        return new TableWriter<R>(writer, columns, format) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                dataLineComposer.accept(record, dataLine);
            }
        };
    }
}
