package org.broadinstitute.varspace.variant;

import htsjdk.samtools.liftover.LiftOver;
import htsjdk.samtools.util.Interval;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.config.ConfigFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * {@link Liftover} over a UCSC chain file (e.g. {@code hg19ToHg38.over.chain.gz}) using htsjdk.
 * <p>
 * Chain files name contigs with a prefix ({@code chr6}); the prefix is added to the normalized chromosome before
 * lookup. A position that maps onto another chromosome is treated as unmapped.
 * </p>
 */
public final class ChainFileLiftover implements Liftover {

    private static final Logger logger = LogManager.getLogger(ChainFileLiftover.class);

    private final LiftOver liftOver;
    private final String contigPrefix;

    public ChainFileLiftover(final Path chainFile) {
        this(chainFile, ConfigFactory.getInstance().getWorkspaceConfig().liftover_contig_prefix());
    }

    public ChainFileLiftover(final Path chainFile, final String contigPrefix) {
        Utils.nonNull(chainFile, "the chain file cannot be null");
        if (!Files.isReadable(chainFile)) {
            throw new UserException.CouldNotReadInputFile(chainFile, "the chain file is not readable", null);
        }
        this.liftOver = new LiftOver(chainFile.toFile());
        this.contigPrefix = Utils.nonNull(contigPrefix, "the contig prefix cannot be null");
        logger.info("Loaded liftover chain " + chainFile);
    }

    @Override
    public OptionalInt translate(final String chromosome, final int hg19Position) {
        final String contig = contigPrefix + VariantKey.normalizeChromosome(chromosome);
        final Interval lifted = liftOver.liftOver(new Interval(contig, hg19Position, hg19Position));
        if (lifted == null) {
            return OptionalInt.empty();
        }
        if (!VariantKey.normalizeChromosome(lifted.getContig()).equals(VariantKey.normalizeChromosome(chromosome))) {
            logger.debug(contig + ":" + hg19Position + " lifts over to another contig, " + lifted.getContig());
            return OptionalInt.empty();
        }
        return OptionalInt.of(lifted.getStart());
    }
}
