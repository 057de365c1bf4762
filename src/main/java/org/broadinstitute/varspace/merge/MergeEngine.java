package org.broadinstitute.varspace.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.variant.KeyColumnMapping;
import org.broadinstitute.varspace.variant.Liftover;
import org.broadinstitute.varspace.variant.VariantKey;
import org.broadinstitute.varspace.variant.VariantKeyExtractor;
import org.broadinstitute.varspace.workspace.FileStore;
import org.broadinstitute.varspace.workspace.OperationLock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outer join of up to four source tables on {@link VariantKey}.
 * <p>
 * The output has one row per distinct key, in the order keys are first seen walking the sources in
 * {@link SourceRole} priority and each source in file order. Its columns are the key column
 * {@value KeyColumnMapping#MERGED_KEY_COLUMN}, then every column of every source namespaced by role
 * ({@code primary.Position}), then one {@code <role>_count} column per source giving how many of its rows carried
 * the key. A source without the key leaves its block empty and its count at 0; a source with the key on several
 * rows shows the first of them. Rows without a derivable key are not joined: each is written on its own with an
 * empty key column.
 * </p>
 */
public final class MergeEngine {

    private static final Logger logger = LogManager.getLogger(MergeEngine.class);

    private final FileStore store;
    private final Map<SourceRole, KeyColumnMapping> mappings;
    private final Liftover liftover;

    /**
     * @param mappings key mapping per role; a merge may only use roles that have one.
     * @param liftover used for sources on hg19; may be {@code null} if none is.
     */
    public MergeEngine(final FileStore store, final Map<SourceRole, KeyColumnMapping> mappings, final Liftover liftover) {
        this.store = Utils.nonNull(store, "the file store cannot be null");
        Utils.nonNull(mappings, "the key mappings cannot be null");
        this.mappings = mappings.isEmpty() ? new EnumMap<>(SourceRole.class) : new EnumMap<>(mappings);
        this.liftover = liftover;
    }

    /**
     * Merges sources that must fit a {@link JoinPreset}.
     */
    public MergeResult mergeSources(final String savePath, final Map<SourceRole, String> sources, final boolean override, final JoinPreset preset) {
        Utils.nonNull(preset, "the join preset cannot be null");
        Utils.nonNull(sources, "the sources cannot be null");
        preset.validate(sources.keySet());
        return mergeSources(savePath, sources, override);
    }

    /**
     * Merges any non-empty set of sources into a new file.
     *
     * @param savePath file id of the output.
     * @param sources  file id per role.
     * @param override whether an existing output may be replaced.
     * @throws UserException.InvalidExtension if {@code savePath} lacks the table extension.
     * @throws UserException.Busy             if another operation holds {@code savePath}.
     * @throws UserException.PathConflict     if {@code savePath} exists and {@code override} is false.
     * @throws UserException.NotFound         if a source does not exist.
     * @throws UserException.ValidationError  if a role has no mapping or its mapping names missing columns.
     */
    public MergeResult mergeSources(final String savePath, final Map<SourceRole, String> sources, final boolean override) {
        Utils.nonNull(savePath, "the save path cannot be null");
        Utils.nonNull(sources, "the sources cannot be null");
        if (sources.isEmpty()) {
            throw new UserException.ValidationError("a merge needs at least one source");
        }
        final Map<SourceRole, String> ordered = new EnumMap<>(sources);
        for (final Map.Entry<SourceRole, String> source : ordered.entrySet()) {
            Utils.nonNull(source.getValue(), () -> "no file given for " + source.getKey().label());
            if (!mappings.containsKey(source.getKey())) {
                throw new UserException.ValidationError("no key mapping is configured for the " + source.getKey().label() + " source");
            }
        }

        store.getNamer().requireExtension(savePath);
        try (final OperationLock.Permit ignored = store.lockForWrite(savePath)) {
            store.getNamer().checkTarget(savePath, override);
            logger.info("Merging " + ordered + " into " + savePath);

            final Map<String, Table> snapshot = store.readSnapshot(ordered.values());
            final Map<SourceRole, Table> tables = new EnumMap<>(SourceRole.class);
            final Map<SourceRole, VariantKeyExtractor> extractors = new EnumMap<>(SourceRole.class);
            for (final Map.Entry<SourceRole, String> source : ordered.entrySet()) {
                final Table table = snapshot.get(source.getValue());
                tables.put(source.getKey(), table);
                extractors.put(source.getKey(), new VariantKeyExtractor(mappings.get(source.getKey()), table.columns(), liftover,
                        source.getKey().label() + " source " + source.getValue()));
            }

            final Table merged = join(tables, extractors);
            store.writeNew(savePath, merged, override);

            final Map<SourceRole, Integer> perRoleCounts = new EnumMap<>(SourceRole.class);
            tables.forEach((role, table) -> perRoleCounts.put(role, table.rowCount()));
            final int unkeyed = (int) merged.rows().stream().filter(row -> row.get(0).isEmpty()).count();
            extractors.forEach((role, extractor) -> {
                if (extractor.getLiftoverMisses() > 0) {
                    logger.warn(extractor.getLiftoverMisses() + " " + role.label() + " rows did not lift over to hg38");
                }
            });
            if (unkeyed > 0) {
                logger.warn(unkeyed + " rows had no usable variant key and were written unjoined");
            }
            final MergeResult result = new MergeResult(savePath, merged.rowCount(), perRoleCounts, unkeyed);
            logger.info("Merge finished: " + result);
            return result;
        }
    }

    private static Table join(final Map<SourceRole, Table> tables, final Map<SourceRole, VariantKeyExtractor> extractors) {
        final List<MergedRow> outputRows = new ArrayList<>();
        final Map<VariantKey, MergedRow> byKey = new HashMap<>();

        for (final Map.Entry<SourceRole, Table> source : tables.entrySet()) {
            final SourceRole role = source.getKey();
            final VariantKeyExtractor extractor = extractors.get(role);
            for (final List<String> row : source.getValue().rows()) {
                final Optional<VariantKey> key = extractor.extract(row);
                final MergedRow merged;
                if (key.isPresent()) {
                    merged = byKey.computeIfAbsent(key.get(), k -> {
                        final MergedRow created = new MergedRow(k);
                        outputRows.add(created);
                        return created;
                    });
                } else {
                    merged = new MergedRow(null);
                    outputRows.add(merged);
                }
                merged.add(role, row);
            }
        }

        final List<String> header = new ArrayList<>();
        header.add(KeyColumnMapping.MERGED_KEY_COLUMN);
        tables.forEach((role, table) -> table.header().forEach(column -> header.add(role.namespace(column))));
        tables.keySet().forEach(role -> header.add(role.countColumn()));

        final List<List<String>> rows = new ArrayList<>(outputRows.size());
        for (final MergedRow merged : outputRows) {
            final List<String> row = new ArrayList<>(header.size());
            row.add(merged.key == null ? "" : merged.key.toString());
            tables.forEach((role, table) -> {
                final List<String> cells = merged.firstRows.get(role);
                row.addAll(cells != null ? cells : Collections.nCopies(table.columnCount(), ""));
            });
            tables.keySet().forEach(role -> row.add(Integer.toString(merged.counts.getOrDefault(role, 0))));
            rows.add(row);
        }
        return new Table(header, rows);
    }

    /**
     * Output row being assembled: the first row each source had for the key and how many it had.
     */
    private static final class MergedRow {
        private final VariantKey key;
        private final Map<SourceRole, List<String>> firstRows = new EnumMap<>(SourceRole.class);
        private final Map<SourceRole, Integer> counts = new EnumMap<>(SourceRole.class);

        private MergedRow(final VariantKey key) {
            this.key = key;
        }

        private void add(final SourceRole role, final List<String> row) {
            firstRows.putIfAbsent(role, row);
            counts.merge(role, 1, Integer::sum);
        }
    }
}
