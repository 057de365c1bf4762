package org.broadinstitute.varspace.workspace;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.exceptions.VarspaceException;
import org.broadinstitute.varspace.query.PageRequest;
import org.broadinstitute.varspace.query.QueryEngine;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.table.TableFiles;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.config.WorkspaceConfig;
import org.broadinstitute.varspace.utils.tsv.TableFormat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed table storage for one workspace.
 * <p>
 * Reads hold a shared {@link OperationLock} permit on the file, replacements hold the exclusive one. A file
 * is never partially written: new content goes to a temporary file in the same directory, which is then moved
 * over the target.
 * </p>
 */
public final class FileStore {

    private static final Logger logger = LogManager.getLogger(FileStore.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private final PathNamer namer;
    private final OperationLock lock;

    public FileStore(final PathNamer namer, final OperationLock lock) {
        this.namer = Utils.nonNull(namer, "the path namer cannot be null");
        this.lock = Utils.nonNull(lock, "the operation lock cannot be null");
    }

    /**
     * Creates a store over {@code root} with the extension and lock waits of {@code config}.
     */
    public FileStore(final Path root, final WorkspaceConfig config) {
        this(new PathNamer(root, config.table_extension()),
                new OperationLock(config.lock_read_wait_millis(), config.lock_write_wait_millis()));
    }

    /**
     * Creates a store over the configured {@code workspace_root}.
     */
    public FileStore(final WorkspaceConfig config) {
        this(Paths.get(config.workspace_root()), config);
    }

    public PathNamer getNamer() {
        return namer;
    }

    // ----------------------------------------------------------
    // Views
    // ----------------------------------------------------------

    /**
     * Returns one page of the file's filtered and sorted rows.
     *
     * @throws UserException.NotFound        if the file does not exist.
     * @throws UserException.ValidationError if the request is malformed or names unknown columns.
     */
    public Page getPage(final String fileId, final PageRequest request) {
        Utils.nonNull(request, "the page request cannot be null");
        final Table table = readTable(fileId);
        final List<Integer> view = QueryEngine.resolve(table, request.getFilter(), request.getSort());
        final List<Integer> window = QueryEngine.paginate(view, request.getPage(), request.getRowsPerPage());
        final List<List<String>> rows = window.stream().map(table::row).collect(Collectors.toList());
        return new Page(table.header(), rows, view.size(), request.getPage(), request.getRowsPerPage());
    }

    /**
     * Writes edited rows back into the window they were read from.
     * <p>
     * The window is recomputed against the current file content with the same request, and {@code editedRows}
     * replace exactly those rows; all other rows are kept. The submitted header replaces the stored one.
     * </p>
     *
     * @throws UserException.ConflictError   if the recomputed window does not hold {@code editedRows.size()} rows.
     * @throws UserException.ValidationError if the header or a row has the wrong number of columns.
     * @throws UserException.Busy            if another operation holds the file.
     * @throws UserException.NotFound        if the file does not exist.
     */
    public void save(final String fileId, final List<String> header, final List<? extends List<String>> editedRows, final PageRequest request) {
        Utils.nonNull(header, "the header cannot be null");
        Utils.nonNull(editedRows, "the edited rows cannot be null");
        Utils.nonNull(request, "the page request cannot be null");

        final Path path = namer.resolve(fileId);
        try (final OperationLock.Permit ignored = lock.acquireExclusive(path, fileId)) {
            final Table current = read(fileId, path);
            final List<Integer> view = QueryEngine.resolve(current, request.getFilter(), request.getSort());
            final List<Integer> window = QueryEngine.paginate(view, request.getPage(), request.getRowsPerPage());
            if (window.size() != editedRows.size()) {
                throw new UserException.ConflictError(fileId, editedRows.size(), window.size());
            }
            final Table updated = current.withRowsReplaced(window, header, editedRows);
            replace(fileId, path, updated);
            logger.info("Saved " + window.size() + " rows into " + fileId);
        }
    }

    // ----------------------------------------------------------
    // Whole-table access
    // ----------------------------------------------------------

    /**
     * Reads a whole table under a shared permit.
     */
    public Table readTable(final String fileId) {
        final Path path = namer.resolve(fileId);
        try (final OperationLock.Permit ignored = lock.acquireShared(path, fileId)) {
            return read(fileId, path);
        }
    }

    /**
     * Reads several tables as one snapshot: shared permits on all of them are taken before any is read and
     * held until all are read.
     *
     * @return the tables keyed by file id, in the order given.
     */
    public Map<String, Table> readSnapshot(final Collection<String> fileIds) {
        Utils.nonNull(fileIds, "the file ids cannot be null");
        // lock in path order
        final Map<Path, String> byPath = new TreeMap<>();
        for (final String fileId : fileIds) {
            byPath.put(namer.resolve(fileId), fileId);
        }
        final List<OperationLock.Permit> permits = new ArrayList<>(byPath.size());
        try {
            for (final Map.Entry<Path, String> entry : byPath.entrySet()) {
                permits.add(lock.acquireShared(entry.getKey(), entry.getValue()));
            }
            final Map<String, Table> snapshot = new LinkedHashMap<>();
            for (final String fileId : fileIds) {
                snapshot.computeIfAbsent(fileId, id -> read(id, namer.resolve(id)));
            }
            logger.debug("Took a snapshot of " + snapshot.keySet());
            return snapshot;
        } finally {
            permits.forEach(OperationLock.Permit::close);
        }
    }

    public boolean exists(final String fileId) {
        return namer.exists(fileId);
    }

    /**
     * Allocates an unused file id; see {@link PathNamer#createUnique}.
     */
    public String createUnique(final String directory, final String baseName, final String extension) {
        return namer.createUnique(directory, baseName, extension);
    }

    /**
     * Takes the exclusive permit on a file that is about to be created or replaced, e.g. by a merge.
     */
    public OperationLock.Permit lockForWrite(final String fileId) {
        return lock.acquireExclusive(namer.resolve(fileId), fileId);
    }

    /**
     * Writes a table to a new or replaced file. The caller must hold the permit from {@link #lockForWrite}.
     *
     * @throws UserException.InvalidExtension if the file id lacks the required extension.
     * @throws UserException.PathConflict     if the file exists and {@code override} is false.
     */
    public void writeNew(final String fileId, final Table table, final boolean override) {
        Utils.nonNull(table, "the table cannot be null");
        final Path path = namer.resolve(fileId);
        if (!lock.isWriteLockedByCurrentThread(path)) {
            throw new VarspaceException("the exclusive permit on " + fileId + " must be held to write it");
        }
        namer.checkTarget(fileId, override);
        replace(fileId, path, table);
        logger.info("Wrote " + table.rowCount() + " rows to " + fileId);
    }

    /**
     * @throws UserException.NotFound if the file does not exist.
     */
    public void delete(final String fileId) {
        final Path path = namer.resolve(fileId);
        try (final OperationLock.Permit ignored = lock.acquireExclusive(path, fileId)) {
            if (!Files.isRegularFile(path)) {
                throw new UserException.NotFound(fileId);
            }
            Files.delete(path);
            logger.info("Deleted " + fileId);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    /**
     * Lists the table files directly inside a workspace directory.
     *
     * @param directory workspace-relative directory; empty for the root.
     * @return sorted file ids; empty if the directory does not exist.
     */
    public List<String> list(final String directory) {
        Utils.nonNull(directory, "the directory cannot be null");
        final Path dir = directory.isEmpty() ? namer.getRoot() : namer.resolve(directory);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (final Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> TableFormat.fromFileName(p.getFileName().toString()).isPresent())
                    .map(namer::toFileId)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(dir, e);
        }
    }

    // ----------------------------------------------------------
    // Internals
    // ----------------------------------------------------------

    private Table read(final String fileId, final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UserException.NotFound(fileId);
        }
        return TableFiles.read(path, namer.formatOf(fileId));
    }

    private void replace(final String fileId, final Path target, final Table table) {
        final TableFormat format = namer.formatOf(fileId);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), TEMP_SUFFIX);
            try (final Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                TableFiles.write(out, table, format);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move is not supported for " + target + "; replacing it non-atomically");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotCreateOutputFile(target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void deleteQuietly(final Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (final IOException e) {
            logger.warn("Could not delete temporary file " + temp, e);
        }
    }
}
