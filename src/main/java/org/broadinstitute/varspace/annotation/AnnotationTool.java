package org.broadinstitute.varspace.annotation;

import java.util.Locale;

/**
 * Pathogenicity scoring tools whose results can be appended to a table.
 * <p>
 * Tools differ only in the {@link AnnotationProvider} registered for them.
 * </p>
 */
public enum AnnotationTool {
    /** Splice-altering predictions from model inference. */
    SPLICEAI,
    /** Deleteriousness scores from a remote lookup service. */
    CADD,
    /** Missense pathogenicity from an indexed local score table. */
    ALPHAMISSENSE;

    /**
     * Suffix of the columns this tool appends, e.g. {@code _cadd}.
     */
    public String columnSuffix() {
        return "_" + name().toLowerCase(Locale.ROOT);
    }
}
