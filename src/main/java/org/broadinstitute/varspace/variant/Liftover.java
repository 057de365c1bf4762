package org.broadinstitute.varspace.variant;

import java.util.OptionalInt;

/**
 * Translates positions from {@link ReferenceBuild#HG19} to {@link ReferenceBuild#HG38}.
 */
@FunctionalInterface
public interface Liftover {

    /**
     * @param chromosome   normalized chromosome name, e.g. {@code 6}.
     * @param hg19Position 1-based position on hg19.
     * @return the hg38 position, or empty if the position does not map.
     */
    OptionalInt translate(String chromosome, int hg19Position);
}
