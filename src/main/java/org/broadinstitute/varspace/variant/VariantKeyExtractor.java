package org.broadinstitute.varspace.variant;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.tsv.TableColumnCollection;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Derives {@link VariantKey}s from the rows of one table according to a {@link KeyColumnMapping}.
 * <p>
 * Rows whose key cannot be derived (blank or malformed coordinates, positions that do not lift over) yield an
 * empty result rather than an error.
 * </p>
 */
public final class VariantKeyExtractor {

    private static final Logger logger = LogManager.getLogger(VariantKeyExtractor.class);

    private final KeyColumnMapping mapping;
    private final Liftover liftover;
    private final String sourceName;

    private final int keyIndex;
    private final int chromosomeIndex;
    private final int positionIndex;
    private final int referenceIndex;
    private final int alternateIndex;
    private final int transcriptIndex;

    private int liftoverMisses;

    /**
     * @param liftover required when the mapping is on {@link ReferenceBuild#HG19}, otherwise may be {@code null}.
     * @throws UserException.ValidationError if {@code columns} lacks a mapped column or no liftover is available
     *                                       for hg19 coordinates.
     */
    public VariantKeyExtractor(final KeyColumnMapping mapping, final TableColumnCollection columns, final Liftover liftover, final String sourceName) {
        this.mapping = Utils.nonNull(mapping, "the mapping cannot be null");
        this.sourceName = Utils.nonNull(sourceName);
        Utils.nonNull(columns, "the columns cannot be null");
        mapping.validate(columns, sourceName);
        if (mapping.getBuild() == ReferenceBuild.HG19 && liftover == null) {
            throw new UserException.ValidationError(sourceName + " is keyed on hg19 but no liftover is configured");
        }
        this.liftover = liftover;

        keyIndex = indexOf(columns, mapping.getKeyColumn());
        chromosomeIndex = indexOf(columns, mapping.getChromosomeColumn());
        positionIndex = indexOf(columns, mapping.getPositionColumn());
        referenceIndex = indexOf(columns, mapping.getReferenceColumn());
        alternateIndex = indexOf(columns, mapping.getAlternateColumn());
        transcriptIndex = indexOf(columns, mapping.getTranscriptColumn());
    }

    private static int indexOf(final TableColumnCollection columns, final String name) {
        return name == null ? -1 : columns.indexOf(name);
    }

    /**
     * Derives the key of a row, in hg38 coordinates.
     */
    public Optional<VariantKey> extract(final List<String> row) {
        final Optional<VariantKey> key = mapping.isComposite()
                ? mapping.getKeyFormat().parse(row.get(keyIndex), mapping.getFixedChromosome())
                : VariantKey.tryCreate(row.get(chromosomeIndex), row.get(positionIndex), row.get(referenceIndex), row.get(alternateIndex));
        if (!key.isPresent() || mapping.getBuild() == ReferenceBuild.HG38) {
            return key;
        }
        final VariantKey hg19 = key.get();
        final OptionalInt lifted = liftover.translate(hg19.getChromosome(), hg19.getPosition());
        if (!lifted.isPresent()) {
            liftoverMisses++;
            logger.debug(sourceName + ": " + hg19 + " does not lift over to hg38");
            return Optional.empty();
        }
        return Optional.of(hg19.withPosition(lifted.getAsInt()));
    }

    /**
     * The transcript of a row, if the mapping names a transcript column and the cell is not blank.
     */
    public Optional<String> transcript(final List<String> row) {
        if (transcriptIndex < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(StringUtils.trimToNull(row.get(transcriptIndex)));
    }

    /**
     * Number of rows so far whose hg19 position did not lift over.
     */
    public int getLiftoverMisses() {
        return liftoverMisses;
    }

    public KeyColumnMapping getMapping() {
        return mapping;
    }
}
