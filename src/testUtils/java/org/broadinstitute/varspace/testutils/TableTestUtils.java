package org.broadinstitute.varspace.testutils;

import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.table.TableFiles;
import org.broadinstitute.varspace.utils.tsv.TableFormat;
import org.broadinstitute.varspace.workspace.FileStore;
import org.broadinstitute.varspace.workspace.OperationLock;
import org.broadinstitute.varspace.workspace.PathNamer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builders for tables and workspaces used across tests.
 */
public final class TableTestUtils {

    private TableTestUtils() {}

    /**
     * Builds a table from a header and rows given as arrays.
     */
    public static Table table(final List<String> header, final String[]... rows) {
        final List<List<String>> rowList = new ArrayList<>(rows.length);
        for (final String[] row : rows) {
            rowList.add(Arrays.asList(row));
        }
        return new Table(header, rowList);
    }

    /**
     * Builds a one-column table.
     */
    public static Table singleColumn(final String column, final String... values) {
        return new Table(Arrays.asList(column),
                Arrays.stream(values).map(v -> Arrays.asList(v)).collect(Collectors.toList()));
    }

    public static List<String> row(final String... cells) {
        return Arrays.asList(cells);
    }

    /**
     * Returns the cells of one column in row order.
     */
    public static List<String> column(final Table table, final String name) {
        final int index = table.requireColumn(name);
        return table.rows().stream().map(r -> r.get(index)).collect(Collectors.toList());
    }

    /**
     * Store over {@code root} requiring {@code .csv} targets, waiting 1s for reads and failing writes fast.
     */
    public static FileStore newStore(final Path root) {
        return new FileStore(new PathNamer(root, ".csv"), new OperationLock(1000, 0));
    }

    /**
     * Writes a table file directly, without going through a store.
     */
    public static void writeTable(final Path root, final String fileId, final Table table) {
        final Path path = root.resolve(fileId);
        try {
            Files.createDirectories(path.getParent());
            try (final Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                TableFiles.write(out, table, TableFormat.fromFileName(fileId).orElse(TableFormat.CSV));
            }
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Table readTable(final Path root, final String fileId) {
        return TableFiles.read(root.resolve(fileId), TableFormat.fromFileName(fileId).orElse(TableFormat.CSV));
    }
}
