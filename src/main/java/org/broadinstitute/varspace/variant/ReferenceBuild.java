package org.broadinstitute.varspace.variant;

/**
 * Human reference genome builds that source coordinates may be given in. Keys are always formed in {@link #HG38}.
 */
public enum ReferenceBuild {
    /** GRCh37; coordinates are lifted over before a key is formed. */
    HG19,
    /** GRCh38. */
    HG38
}
