package org.broadinstitute.varspace.variant;

import htsjdk.samtools.util.Locatable;
import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.varspace.utils.Utils;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identity of a variant across sources: chromosome, position, reference allele and alternate allele.
 * <p>
 * The chromosome is normalized ({@code chr6}, {@code 6} and {@code NC_000006.12} all become {@code 6}) and
 * alleles are upper-cased. The text form is {@code chrom-pos-ref-alt}, e.g. {@code 6-152129077-G-A}.
 * </p>
 */
public final class VariantKey implements Locatable {

    private static final Pattern REFSEQ_CHROMOSOME = Pattern.compile("^NC_0*(\\d+)(\\.\\d+)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALLELE = Pattern.compile("^[A-Z*]+$");

    private final String chromosome;
    private final int position;
    private final String reference;
    private final String alternate;

    /**
     * @throws IllegalArgumentException if a component is malformed.
     */
    public VariantKey(final String chromosome, final int position, final String reference, final String alternate) {
        this.chromosome = normalizeChromosome(chromosome);
        Utils.validateArg(!this.chromosome.isEmpty(), () -> "invalid chromosome: " + chromosome);
        Utils.validateArg(position > 0, () -> "position must be positive: " + position);
        this.position = position;
        this.reference = normalizeAllele(reference);
        this.alternate = normalizeAllele(alternate);
    }

    /**
     * Builds a key from text components, as found in table cells.
     *
     * @return empty if any component is blank or malformed.
     */
    public static Optional<VariantKey> tryCreate(final String chromosome, final String position, final String reference, final String alternate) {
        if (StringUtils.isAnyBlank(chromosome, position, reference, alternate)) {
            return Optional.empty();
        }
        final int pos;
        try {
            pos = Integer.parseInt(position.trim());
        } catch (final NumberFormatException e) {
            return Optional.empty();
        }
        if (pos <= 0 || normalizeChromosome(chromosome).isEmpty()
                || !isAllele(reference) || !isAllele(alternate)) {
            return Optional.empty();
        }
        return Optional.of(new VariantKey(chromosome, pos, reference, alternate));
    }

    /**
     * Parses the {@code chrom-pos-ref-alt} text form.
     */
    public static Optional<VariantKey> parse(final String text) {
        return KeyFormat.DASHED.parse(text, null);
    }

    /**
     * Reduces a chromosome name to its bare form: trims, removes a {@code chr} prefix, reduces RefSeq
     * {@code NC_} accessions to their chromosome number and upper-cases the rest.
     */
    public static String normalizeChromosome(final String chromosome) {
        String name = StringUtils.trimToEmpty(chromosome);
        if (StringUtils.startsWithIgnoreCase(name, "chr")) {
            name = name.substring(3);
        }
        final Matcher refseq = REFSEQ_CHROMOSOME.matcher(name);
        if (refseq.matches()) {
            name = refseq.group(1);
        }
        return name.toUpperCase(Locale.ROOT);
    }

    private static boolean isAllele(final String allele) {
        return ALLELE.matcher(StringUtils.trimToEmpty(allele).toUpperCase(Locale.ROOT)).matches();
    }

    private static String normalizeAllele(final String allele) {
        final String normalized = StringUtils.trimToEmpty(allele).toUpperCase(Locale.ROOT);
        Utils.validateArg(ALLELE.matcher(normalized).matches(), () -> "invalid allele: " + allele);
        return normalized;
    }

    /**
     * Returns this key moved to another position on the same chromosome.
     */
    public VariantKey withPosition(final int newPosition) {
        return new VariantKey(chromosome, newPosition, reference, alternate);
    }

    public String getChromosome() {
        return chromosome;
    }

    public int getPosition() {
        return position;
    }

    public String getReference() {
        return reference;
    }

    public String getAlternate() {
        return alternate;
    }

    @Override
    public String getContig() {
        return chromosome;
    }

    @Override
    public int getStart() {
        return position;
    }

    @Override
    public int getEnd() {
        return position + reference.length() - 1;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof VariantKey)) return false;
        final VariantKey that = (VariantKey) o;
        return position == that.position && chromosome.equals(that.chromosome)
                && reference.equals(that.reference) && alternate.equals(that.alternate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chromosome, position, reference, alternate);
    }

    @Override
    public String toString() {
        return chromosome + "-" + position + "-" + reference + "-" + alternate;
    }
}
