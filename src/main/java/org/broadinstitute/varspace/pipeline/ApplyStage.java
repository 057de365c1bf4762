package org.broadinstitute.varspace.pipeline;

import org.broadinstitute.varspace.annotation.AnnotationTool;
import org.broadinstitute.varspace.annotation.ApplyEngine;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;

import java.util.Locale;

/**
 * Annotates the previous stage's output.
 */
public final class ApplyStage implements PipelineStage {

    private final ApplyEngine engine;
    private final String savePath;
    private final AnnotationTool tool;
    private final boolean override;

    public ApplyStage(final ApplyEngine engine, final String savePath, final AnnotationTool tool, final boolean override) {
        this.engine = Utils.nonNull(engine, "the apply engine cannot be null");
        this.savePath = Utils.nonNull(savePath, "the save path cannot be null");
        this.tool = Utils.nonNull(tool, "the tool cannot be null");
        this.override = override;
    }

    @Override
    public String getName() {
        return tool.name().toLowerCase(Locale.ROOT) + " into " + savePath;
    }

    @Override
    public String run(final String previousOutput) {
        if (previousOutput == null) {
            throw new UserException.ValidationError(getName() + " expects the output of a previous stage");
        }
        return engine.applyAnnotation(savePath, tool, previousOutput, override).getFileId();
    }
}
