package org.broadinstitute.varspace.pipeline;

import org.broadinstitute.varspace.utils.Utils;

/**
 * Downloads a source table; ignores any previous output.
 */
public final class DownloadStage implements PipelineStage {

    private final SourceDownloader downloader;
    private final String source;
    private final String gene;
    private final boolean override;

    public DownloadStage(final SourceDownloader downloader, final String source, final String gene, final boolean override) {
        this.downloader = Utils.nonNull(downloader, "the downloader cannot be null");
        this.source = Utils.nonEmpty(source, "the source cannot be empty");
        this.gene = Utils.nonEmpty(gene, "the gene cannot be empty");
        this.override = override;
    }

    @Override
    public String getName() {
        return "download " + source + " " + gene;
    }

    @Override
    public String run(final String previousOutput) {
        return downloader.fetch(source, gene, override);
    }
}
