package org.broadinstitute.varspace.pipeline;

/**
 * Fetches the raw variant table of a public source (e.g. LOVD, gnomAD, ClinVar) for a gene into the workspace.
 */
@FunctionalInterface
public interface SourceDownloader {

    /**
     * @param source   name of the source to download from.
     * @param gene     gene symbol to download variants of.
     * @param override whether an existing download may be replaced.
     * @return file id of the downloaded table, in the source's own schema.
     */
    String fetch(String source, String gene, boolean override);
}
