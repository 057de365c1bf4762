package org.broadinstitute.varspace.variant;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.OptionalInt;

public final class ChainFileLiftoverUnitTest extends BaseTest {

    private ChainFileLiftover liftover;

    @BeforeClass
    public void writeChain() throws IOException {
        final Path chain = createTempDir("chain").resolve("hg19ToHg38.over.chain");
        // chr6 [1000, 2000) moves to [5000, 6000); chr7 [1000, 2000) moves onto chr8
        Files.write(chain, Arrays.asList(
                "chain 1000 chr6 10000 + 1000 2000 chr6 10000 + 5000 6000 1",
                "1000",
                "",
                "chain 1000 chr7 10000 + 1000 2000 chr8 10000 + 1000 2000 2",
                "1000",
                ""), StandardCharsets.UTF_8);
        liftover = new ChainFileLiftover(chain, "chr");
    }

    @Test
    public void testMappedPosition() {
        Assert.assertEquals(liftover.translate("6", 1001), OptionalInt.of(5001));
        Assert.assertEquals(liftover.translate("chr6", 1500), OptionalInt.of(5500));
    }

    @Test
    public void testUnmappedPosition() {
        Assert.assertFalse(liftover.translate("6", 3000).isPresent());
        Assert.assertFalse(liftover.translate("9", 1500).isPresent());
    }

    @Test
    public void testMoveToAnotherChromosomeIsUnmapped() {
        Assert.assertFalse(liftover.translate("7", 1500).isPresent());
    }

    @Test
    public void testMissingChainFile() {
        Assert.assertThrows(UserException.CouldNotReadInputFile.class,
                () -> new ChainFileLiftover(createTempDir("noChain").resolve("absent.chain"), "chr"));
    }
}
