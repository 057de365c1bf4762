package org.broadinstitute.varspace.variant;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text encodings of a whole {@link VariantKey} in a single column.
 */
public enum KeyFormat {

    /**
     * {@code 6-152129077-G-A}, as written by gnomAD and by merges.
     */
    DASHED {
        @Override
        public Optional<VariantKey> parse(final String text, final String fixedChromosome) {
            final String[] parts = StringUtils.splitPreserveAllTokens(StringUtils.trimToEmpty(text), '-');
            if (parts.length != 4) {
                return Optional.empty();
            }
            return VariantKey.tryCreate(parts[0], parts[1], parts[2], parts[3]);
        }
    },

    /**
     * Canonical SPDI, e.g. {@code NC_000006.12:152129077:G:A}, as reported by ClinVar. The position is taken
     * as written.
     */
    SPDI {
        @Override
        public Optional<VariantKey> parse(final String text, final String fixedChromosome) {
            final String[] parts = StringUtils.splitPreserveAllTokens(StringUtils.trimToEmpty(text), ':');
            if (parts.length != 4) {
                return Optional.empty();
            }
            return VariantKey.tryCreate(parts[0], parts[1], parts[2], parts[3]);
        }
    },

    /**
     * HGVS genomic substitution, e.g. {@code g.152129077G>A}, as reported by LOVD. The chromosome comes from
     * an accession prefix ({@code NC_000006.12:g.152129077G>A}) or else from the mapping.
     */
    HGVS_GENOMIC {
        private final Pattern substitution = Pattern.compile("^(?:([^:\\s]+):)?g\\.(\\d+)([A-Za-z])>([A-Za-z])$");

        @Override
        public Optional<VariantKey> parse(final String text, final String fixedChromosome) {
            final Matcher m = substitution.matcher(StringUtils.trimToEmpty(text));
            if (!m.matches()) {
                return Optional.empty();
            }
            final String chromosome = m.group(1) != null ? m.group(1) : fixedChromosome;
            return VariantKey.tryCreate(chromosome, m.group(2), m.group(3), m.group(4));
        }
    };

    /**
     * Parses a cell.
     *
     * @param fixedChromosome chromosome to use when the format does not carry one; may be {@code null}.
     * @return empty if the cell does not encode a key in this format.
     */
    public abstract Optional<VariantKey> parse(String text, String fixedChromosome);
}
