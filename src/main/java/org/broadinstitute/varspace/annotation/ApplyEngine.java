package org.broadinstitute.varspace.annotation;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.AnnotationProviderException;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.utils.LRUCache;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.config.ConfigFactory;
import org.broadinstitute.varspace.utils.config.WorkspaceConfig;
import org.broadinstitute.varspace.variant.KeyColumnMapping;
import org.broadinstitute.varspace.variant.Liftover;
import org.broadinstitute.varspace.variant.VariantKey;
import org.broadinstitute.varspace.variant.VariantKeyExtractor;
import org.broadinstitute.varspace.workspace.FileStore;
import org.broadinstitute.varspace.workspace.OperationLock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Appends the scores of an annotation tool to every row of a table, writing the result to a new file.
 * <p>
 * Rows are scored one at a time in file order. A row whose variant cannot be derived or scored gets the NA
 * sentinel in every appended column and the run goes on; only a
 * {@link AnnotationProviderException.SystemicProviderFailure} stops it, in which case nothing is written.
 * Answers are cached per (variant, transcript) pair for the run, NA answers included, so repeated variants
 * are sent to the provider once as long as the cache ({@code annotation_cache_size}) holds them.
 * </p>
 */
public final class ApplyEngine {

    private static final Logger logger = LogManager.getLogger(ApplyEngine.class);

    private final FileStore store;
    private final AnnotationProviderRegistry registry;
    private final KeyColumnMapping mapping;
    private final Liftover liftover;

    private final String naValue;
    private final int maxEntries;
    private final int cacheSize;

    /**
     * @param mapping  how to read variants from the source table.
     * @param liftover used if {@code mapping} is on hg19; may be {@code null} otherwise.
     */
    public ApplyEngine(final FileStore store, final AnnotationProviderRegistry registry, final KeyColumnMapping mapping,
                       final Liftover liftover, final WorkspaceConfig config) {
        this.store = Utils.nonNull(store, "the file store cannot be null");
        this.registry = Utils.nonNull(registry, "the provider registry cannot be null");
        this.mapping = Utils.nonNull(mapping, "the key mapping cannot be null");
        this.liftover = liftover;
        Utils.nonNull(config, "the config cannot be null");
        this.naValue = config.na_value();
        this.maxEntries = config.annotation_max_entries();
        this.cacheSize = config.annotation_cache_size();
        Utils.validateArg(maxEntries >= 0, "annotation_max_entries cannot be negative");
    }

    /**
     * Engine reading merge output ({@value KeyColumnMapping#MERGED_KEY_COLUMN} in dashed form) with the
     * default configuration.
     */
    public ApplyEngine(final FileStore store, final AnnotationProviderRegistry registry) {
        this(store, registry, KeyColumnMapping.mergedOutput(), null, ConfigFactory.getInstance().getWorkspaceConfig());
    }

    /**
     * Annotates {@code sourceFileId} with {@code tool} and writes the result to {@code savePath}.
     *
     * @throws UserException.ValidationError  if no provider is registered for {@code tool} or the source lacks
     *                                        the mapped columns.
     * @throws UserException.InvalidExtension if {@code savePath} lacks the table extension.
     * @throws UserException.Busy             if another operation holds {@code savePath}.
     * @throws UserException.PathConflict     if {@code savePath} exists and {@code override} is false.
     * @throws UserException.NotFound         if the source does not exist.
     * @throws AnnotationProviderException.SystemicProviderFailure if the provider fails as a whole.
     */
    public ApplyResult applyAnnotation(final String savePath, final AnnotationTool tool, final String sourceFileId, final boolean override) {
        Utils.nonNull(savePath, "the save path cannot be null");
        Utils.nonNull(sourceFileId, "the source file cannot be null");
        final AnnotationProvider provider = registry.get(tool);

        store.getNamer().requireExtension(savePath);
        try (final OperationLock.Permit ignored = store.lockForWrite(savePath)) {
            store.getNamer().checkTarget(savePath, override);
            logger.info("Annotating " + sourceFileId + " with " + tool + " (" + provider.getName() + ") into " + savePath);

            final Table source = store.readSnapshot(Collections.singletonList(sourceFileId)).get(sourceFileId);
            final VariantKeyExtractor extractor = new VariantKeyExtractor(mapping, source.columns(), liftover, sourceFileId);

            final List<String> providerColumns = provider.getOutputColumns();
            final List<String> header = new ArrayList<>(source.header());
            header.addAll(appendedColumnNames(source.header(), providerColumns, tool));

            final Map<Pair<VariantKey, String>, Annotation> cache = new LRUCache<>(cacheSize);
            int providerCalls = 0;
            int resolved = 0;
            int unresolved = 0;
            int capped = 0;
            final List<List<String>> rows = new ArrayList<>(source.rowCount());
            for (int i = 0; i < source.rowCount(); i++) {
                final List<String> row = source.row(i);
                final Optional<VariantKey> key = extractor.extract(row);
                Annotation annotation = Annotation.na();
                if (!key.isPresent()) {
                    logger.warn(String.format("%s row %d: no usable variant key", sourceFileId, i + 1));
                } else {
                    final Pair<VariantKey, String> cacheKey = Pair.of(key.get(), extractor.transcript(row).orElse(null));
                    final Annotation cached = cache.get(cacheKey);
                    if (cached != null) {
                        annotation = cached;
                    } else if (providerCalls >= maxEntries) {
                        capped++;
                    } else {
                        providerCalls++;
                        annotation = annotate(provider, cacheKey.getLeft(), cacheKey.getRight(), sourceFileId, i);
                        cache.put(cacheKey, annotation);
                    }
                }

                final List<String> out = new ArrayList<>(header.size());
                out.addAll(row);
                boolean anyScore = false;
                for (final String column : providerColumns) {
                    final Optional<String> score = annotation.getScore(column);
                    anyScore |= score.isPresent();
                    out.add(score.orElse(naValue));
                }
                if (anyScore) {
                    resolved++;
                } else {
                    unresolved++;
                }
                rows.add(out);
            }

            if (capped > 0) {
                logger.warn(capped + " rows were not annotated because the limit of " + maxEntries + " provider calls was reached");
            }
            if (extractor.getLiftoverMisses() > 0) {
                logger.warn(extractor.getLiftoverMisses() + " rows did not lift over to hg38");
            }

            store.writeNew(savePath, new Table(header, rows), override);
            final ApplyResult result = new ApplyResult(savePath, resolved, unresolved);
            logger.info("Annotation finished: " + result + " after " + providerCalls + " provider calls");
            return result;
        }
    }

    private static Annotation annotate(final AnnotationProvider provider, final VariantKey key, final String transcript,
                                       final String sourceFileId, final int rowIndex) {
        try {
            final Annotation annotation = provider.annotate(key, transcript);
            return annotation == null ? Annotation.na() : annotation;
        } catch (final AnnotationProviderException.ProviderUnavailable e) {
            logger.warn(String.format("%s row %d (%s): %s", sourceFileId, rowIndex + 1, key, e.getMessage()));
            return Annotation.na();
        } catch (final AnnotationProviderException.SystemicProviderFailure e) {
            logger.error("Aborting annotation of " + sourceFileId + ": " + e.getMessage());
            throw e;
        }
    }

    /**
     * Names the appended columns {@code <column><suffix>}, adding {@code _1}, {@code _2}... where a name is taken.
     */
    static List<String> appendedColumnNames(final List<String> existing, final List<String> providerColumns, final AnnotationTool tool) {
        final Set<String> taken = new HashSet<>(existing);
        final List<String> names = new ArrayList<>(providerColumns.size());
        for (final String column : providerColumns) {
            final String base = column + tool.columnSuffix();
            String name = base;
            for (int suffix = 1; taken.contains(name); suffix++) {
                name = base + "_" + suffix;
            }
            taken.add(name);
            names.add(name);
        }
        return names;
    }
}
