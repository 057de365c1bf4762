package org.broadinstitute.varspace.variant;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.tsv.TableColumnCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Which columns of a source table hold the parts of a {@link VariantKey}.
 * <p>
 * A key comes either from four split columns (chromosome, position, reference, alternate) or from one composite
 * column in a {@link KeyFormat}. Coordinates may be declared to be on {@link ReferenceBuild#HG19}, in which case
 * they are lifted over. A transcript column may be named for annotation tools keyed by transcript.
 * </p>
 */
public final class KeyColumnMapping {

    /**
     * Key column written first in every merge output, in {@link KeyFormat#DASHED} form.
     */
    public static final String MERGED_KEY_COLUMN = "gen_pos";

    private final String chromosomeColumn;
    private final String positionColumn;
    private final String referenceColumn;
    private final String alternateColumn;

    private final String keyColumn;
    private final KeyFormat keyFormat;
    private final String fixedChromosome;

    private final ReferenceBuild build;
    private final String transcriptColumn;

    private KeyColumnMapping(final String chromosomeColumn, final String positionColumn, final String referenceColumn, final String alternateColumn,
                             final String keyColumn, final KeyFormat keyFormat, final String fixedChromosome,
                             final ReferenceBuild build, final String transcriptColumn) {
        this.chromosomeColumn = chromosomeColumn;
        this.positionColumn = positionColumn;
        this.referenceColumn = referenceColumn;
        this.alternateColumn = alternateColumn;
        this.keyColumn = keyColumn;
        this.keyFormat = keyFormat;
        this.fixedChromosome = fixedChromosome;
        this.build = Utils.nonNull(build, "the reference build cannot be null");
        this.transcriptColumn = transcriptColumn;
    }

    /**
     * Key read from four columns.
     */
    public static KeyColumnMapping splitColumns(final String chromosomeColumn, final String positionColumn,
                                                final String referenceColumn, final String alternateColumn) {
        return new KeyColumnMapping(
                Utils.nonNull(chromosomeColumn, "chromosome column cannot be null"),
                Utils.nonNull(positionColumn, "position column cannot be null"),
                Utils.nonNull(referenceColumn, "reference column cannot be null"),
                Utils.nonNull(alternateColumn, "alternate column cannot be null"),
                null, null, null, ReferenceBuild.HG38, null);
    }

    /**
     * Key read from one column in {@code format}.
     */
    public static KeyColumnMapping composite(final String keyColumn, final KeyFormat format) {
        return new KeyColumnMapping(null, null, null, null,
                Utils.nonNull(keyColumn, "key column cannot be null"),
                Utils.nonNull(format, "key format cannot be null"),
                null, ReferenceBuild.HG38, null);
    }

    /**
     * Key read from an HGVS genomic column whose values do not name their chromosome.
     */
    public static KeyColumnMapping hgvsGenomic(final String keyColumn, final String chromosome) {
        Utils.nonEmpty(chromosome, "the chromosome cannot be empty");
        return new KeyColumnMapping(null, null, null, null,
                Utils.nonNull(keyColumn, "key column cannot be null"), KeyFormat.HGVS_GENOMIC,
                VariantKey.normalizeChromosome(chromosome), ReferenceBuild.HG38, null);
    }

    /**
     * The mapping of a merge output: the {@value #MERGED_KEY_COLUMN} column in dashed form.
     */
    public static KeyColumnMapping mergedOutput() {
        return composite(MERGED_KEY_COLUMN, KeyFormat.DASHED);
    }

    public KeyColumnMapping inBuild(final ReferenceBuild newBuild) {
        return new KeyColumnMapping(chromosomeColumn, positionColumn, referenceColumn, alternateColumn,
                keyColumn, keyFormat, fixedChromosome, newBuild, transcriptColumn);
    }

    public KeyColumnMapping withTranscriptColumn(final String newTranscriptColumn) {
        return new KeyColumnMapping(chromosomeColumn, positionColumn, referenceColumn, alternateColumn,
                keyColumn, keyFormat, fixedChromosome, build, Utils.nonNull(newTranscriptColumn));
    }

    public boolean isComposite() {
        return keyColumn != null;
    }

    public String getChromosomeColumn() {
        return chromosomeColumn;
    }

    public String getPositionColumn() {
        return positionColumn;
    }

    public String getReferenceColumn() {
        return referenceColumn;
    }

    public String getAlternateColumn() {
        return alternateColumn;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public KeyFormat getKeyFormat() {
        return keyFormat;
    }

    public String getFixedChromosome() {
        return fixedChromosome;
    }

    public ReferenceBuild getBuild() {
        return build;
    }

    public String getTranscriptColumn() {
        return transcriptColumn;
    }

    /**
     * All columns the mapping reads, transcript column included.
     */
    public List<String> requiredColumns() {
        final List<String> columns = new ArrayList<>();
        if (isComposite()) {
            columns.add(keyColumn);
        } else {
            Collections.addAll(columns, chromosomeColumn, positionColumn, referenceColumn, alternateColumn);
        }
        if (transcriptColumn != null) {
            columns.add(transcriptColumn);
        }
        return columns;
    }

    /**
     * @throws UserException.ValidationError if {@code columns} lacks a column this mapping reads.
     */
    public void validate(final TableColumnCollection columns, final String sourceName) {
        final List<String> missing = requiredColumns().stream().filter(c -> !columns.contains(c)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new UserException.ValidationError(String.format("%s has no column %s required by its key mapping; available columns are %s",
                    sourceName, missing, columns));
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyColumnMapping)) return false;
        final KeyColumnMapping that = (KeyColumnMapping) o;
        return Objects.equals(chromosomeColumn, that.chromosomeColumn) && Objects.equals(positionColumn, that.positionColumn)
                && Objects.equals(referenceColumn, that.referenceColumn) && Objects.equals(alternateColumn, that.alternateColumn)
                && Objects.equals(keyColumn, that.keyColumn) && keyFormat == that.keyFormat
                && Objects.equals(fixedChromosome, that.fixedChromosome) && build == that.build
                && Objects.equals(transcriptColumn, that.transcriptColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chromosomeColumn, positionColumn, referenceColumn, alternateColumn, keyColumn, keyFormat,
                fixedChromosome, build, transcriptColumn);
    }

    @Override
    public String toString() {
        final String key = isComposite()
                ? keyColumn + " as " + keyFormat + (fixedChromosome == null ? "" : " on " + fixedChromosome)
                : String.join("/", chromosomeColumn, positionColumn, referenceColumn, alternateColumn);
        return "KeyColumnMapping{" + key + ", " + build + (transcriptColumn == null ? "" : ", transcript " + transcriptColumn) + "}";
    }
}
