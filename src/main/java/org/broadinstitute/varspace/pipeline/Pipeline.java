package org.broadinstitute.varspace.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.workspace.FileStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of {@link PipelineStage}s, each reading the file the one before it wrote.
 * <p>
 * A stage counts as complete only once its output file is visible in the workspace. The first stage that fails
 * stops the run; files written by earlier stages are left in place.
 * </p>
 */
public final class Pipeline {

    private static final Logger logger = LogManager.getLogger(Pipeline.class);

    private final FileStore store;
    private final List<PipelineStage> stages;

    public Pipeline(final FileStore store, final List<PipelineStage> stages) {
        this.store = Utils.nonNull(store, "the file store cannot be null");
        Utils.nonEmpty(stages, "a pipeline needs at least one stage");
        Utils.containsNoNull(stages, "pipeline stages cannot be null");
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    public PipelineResult run() {
        final List<String> outputs = new ArrayList<>(stages.size());
        String previous = null;
        for (final PipelineStage stage : stages) {
            logger.info("Running stage '" + stage.getName() + "'");
            try {
                final String output = stage.run(previous);
                if (output == null || !store.exists(output)) {
                    throw new UserException.NotFound(String.valueOf(output));
                }
                outputs.add(output);
                previous = output;
            } catch (final RuntimeException e) {
                logger.error("Stage '" + stage.getName() + "' failed: " + e.getMessage());
                return PipelineResult.failure(outputs, stage.getName(), e);
            }
        }
        logger.info("Pipeline finished; outputs " + outputs);
        return PipelineResult.success(outputs);
    }
}
