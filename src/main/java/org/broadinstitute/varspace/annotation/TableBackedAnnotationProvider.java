package org.broadinstitute.varspace.annotation;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.table.TableFiles;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.tsv.TableFormat;
import org.broadinstitute.varspace.variant.KeyColumnMapping;
import org.broadinstitute.varspace.variant.VariantKey;
import org.broadinstitute.varspace.variant.VariantKeyExtractor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AnnotationProvider} answering from a precomputed score table held in memory, e.g. an AlphaMissense
 * score file.
 * <p>
 * The score table is indexed by variant key, and by transcript as well when the key mapping names a transcript
 * column. The first row for a key wins. Blank score cells are treated as missing scores.
 * </p>
 */
public final class TableBackedAnnotationProvider implements AnnotationProvider {

    private static final Logger logger = LogManager.getLogger(TableBackedAnnotationProvider.class);

    private final String name;
    private final List<String> scoreColumns;
    private final boolean transcriptKeyed;
    private final Map<Pair<VariantKey, String>, Annotation> index;

    /**
     * @param scoreTable   the scores; must hold the mapped key columns and {@code scoreColumns}.
     * @param mapping      how to read variants (and transcripts) from {@code scoreTable}, in hg38.
     * @param scoreColumns columns of {@code scoreTable} to serve as outputs.
     */
    public TableBackedAnnotationProvider(final String name, final Table scoreTable, final KeyColumnMapping mapping, final List<String> scoreColumns) {
        this.name = Utils.nonNull(name, "the provider name cannot be null");
        Utils.nonNull(scoreTable, "the score table cannot be null");
        Utils.nonEmpty(scoreColumns, "at least one score column is required");
        this.scoreColumns = Collections.unmodifiableList(new ArrayList<>(scoreColumns));
        this.transcriptKeyed = mapping.getTranscriptColumn() != null;

        final VariantKeyExtractor extractor = new VariantKeyExtractor(mapping, scoreTable.columns(), null, name);
        final int[] scoreIndices = scoreColumns.stream().mapToInt(scoreTable::requireColumn).toArray();
        this.index = new HashMap<>(scoreTable.rowCount() * 2);
        int unkeyed = 0;
        for (final List<String> row : scoreTable.rows()) {
            final Optional<VariantKey> key = extractor.extract(row);
            if (!key.isPresent()) {
                unkeyed++;
                continue;
            }
            final Map<String, String> scores = new LinkedHashMap<>();
            for (int i = 0; i < scoreIndices.length; i++) {
                final String cell = row.get(scoreIndices[i]);
                if (StringUtils.isNotBlank(cell)) {
                    scores.put(scoreColumns.get(i), cell.trim());
                }
            }
            index.putIfAbsent(Pair.of(key.get(), extractor.transcript(row).orElse(null)), Annotation.of(scores));
        }
        if (unkeyed > 0) {
            logger.warn(name + ": " + unkeyed + " score rows have no usable variant key and were ignored");
        }
        logger.info(name + ": indexed " + index.size() + " scored variants");
    }

    /**
     * Loads the score table from a file.
     */
    public static TableBackedAnnotationProvider fromFile(final String name, final Path scoreFile, final KeyColumnMapping mapping, final List<String> scoreColumns) {
        Utils.nonNull(scoreFile, "the score file cannot be null");
        final TableFormat format = TableFormat.fromFileName(scoreFile.getFileName().toString()).orElse(TableFormat.TSV);
        return new TableBackedAnnotationProvider(name, TableFiles.read(scoreFile, format), mapping, scoreColumns);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getOutputColumns() {
        return scoreColumns;
    }

    @Override
    public Annotation annotate(final VariantKey key, final String transcript) {
        final Annotation annotation = index.get(Pair.of(key, transcriptKeyed ? transcript : null));
        return annotation == null ? Annotation.na() : annotation;
    }
}
