package org.broadinstitute.varspace.variant;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.testutils.BaseTest;
import org.broadinstitute.varspace.testutils.TableTestUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalInt;

import static org.broadinstitute.varspace.testutils.TableTestUtils.row;

public final class VariantKeyExtractorUnitTest extends BaseTest {

    private static final Table SPLIT = TableTestUtils.table(Arrays.asList("Chromosome", "Position", "Ref", "Alt", "Transcript"),
            new String[] {"chr6", "100", "G", "A", "ENST01"},
            new String[] {"6", "", "G", "A", " "});

    /** Adds 1000 on chromosome 6 only. */
    private static final Liftover SHIFT_CHR6 = (chromosome, position) ->
            "6".equals(chromosome) ? OptionalInt.of(position + 1000) : OptionalInt.empty();

    @Test
    public void testSplitColumns() {
        final VariantKeyExtractor extractor = new VariantKeyExtractor(
                KeyColumnMapping.splitColumns("Chromosome", "Position", "Ref", "Alt").withTranscriptColumn("Transcript"),
                SPLIT.columns(), null, "test");
        Assert.assertEquals(extractor.extract(SPLIT.row(0)), Optional.of(new VariantKey("6", 100, "G", "A")));
        Assert.assertFalse(extractor.extract(SPLIT.row(1)).isPresent());
        Assert.assertEquals(extractor.transcript(SPLIT.row(0)), Optional.of("ENST01"));
        Assert.assertFalse(extractor.transcript(SPLIT.row(1)).isPresent());
        Assert.assertEquals(extractor.getLiftoverMisses(), 0);
    }

    @Test
    public void testHgvsWithFixedChromosome() {
        final Table lovd = TableTestUtils.table(Arrays.asList("DNA change (genomic) (hg38)"),
                new String[] {"g.152129077G>A"}, new String[] {"c.5A>T"});
        final VariantKeyExtractor extractor = new VariantKeyExtractor(
                KeyColumnMapping.hgvsGenomic("DNA change (genomic) (hg38)", "chr6"), lovd.columns(), null, "lovd");
        Assert.assertEquals(extractor.extract(lovd.row(0)), Optional.of(new VariantKey("6", 152129077, "G", "A")));
        Assert.assertFalse(extractor.extract(lovd.row(1)).isPresent());
        Assert.assertFalse(extractor.transcript(lovd.row(0)).isPresent());
    }

    @Test
    public void testHg19PositionsAreLifted() {
        final Table hg19 = TableTestUtils.table(Arrays.asList("gen_pos"),
                new String[] {"6-100-G-A"}, new String[] {"7-100-G-A"});
        final VariantKeyExtractor extractor = new VariantKeyExtractor(
                KeyColumnMapping.mergedOutput().inBuild(ReferenceBuild.HG19), hg19.columns(), SHIFT_CHR6, "hg19 source");
        Assert.assertEquals(extractor.extract(hg19.row(0)), Optional.of(new VariantKey("6", 1100, "G", "A")));
        Assert.assertFalse(extractor.extract(hg19.row(1)).isPresent());
        Assert.assertEquals(extractor.getLiftoverMisses(), 1);
    }

    @Test
    public void testHg38IgnoresLiftover() {
        final Table table = TableTestUtils.table(Arrays.asList("gen_pos"), new String[] {"6-100-G-A"});
        final VariantKeyExtractor extractor = new VariantKeyExtractor(KeyColumnMapping.mergedOutput(), table.columns(), SHIFT_CHR6, "hg38");
        Assert.assertEquals(extractor.extract(row("6-100-G-A")), Optional.of(new VariantKey("6", 100, "G", "A")));
    }

    @Test
    public void testHg19WithoutLiftoverIsRejected() {
        final Table table = TableTestUtils.table(Arrays.asList("gen_pos"), new String[] {"6-100-G-A"});
        Assert.assertThrows(UserException.ValidationError.class, () -> new VariantKeyExtractor(
                KeyColumnMapping.mergedOutput().inBuild(ReferenceBuild.HG19), table.columns(), null, "hg19"));
    }

    @Test
    public void testMissingColumnsAreRejected() {
        final UserException.ValidationError e = Assert.expectThrows(UserException.ValidationError.class,
                () -> new VariantKeyExtractor(KeyColumnMapping.splitColumns("Chromosome", "Pos", "Ref", "Alt"), SPLIT.columns(), null, "clinvar"));
        Assert.assertTrue(e.getMessage().contains("clinvar"));
        Assert.assertTrue(e.getMessage().contains("Pos"));
    }

    @Test
    public void testRequiredColumns() {
        Assert.assertEquals(KeyColumnMapping.splitColumns("c", "p", "r", "a").withTranscriptColumn("t").requiredColumns(),
                Arrays.asList("c", "p", "r", "a", "t"));
        Assert.assertEquals(KeyColumnMapping.mergedOutput().requiredColumns(), Arrays.asList(KeyColumnMapping.MERGED_KEY_COLUMN));
        Assert.assertTrue(KeyColumnMapping.mergedOutput().isComposite());
        Assert.assertEquals(KeyColumnMapping.hgvsGenomic("hgvs", "chr6").getFixedChromosome(), "6");
    }
}
