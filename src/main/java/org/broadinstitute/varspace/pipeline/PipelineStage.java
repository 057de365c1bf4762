package org.broadinstitute.varspace.pipeline;

/**
 * One step of a {@link Pipeline} producing a file in the workspace.
 */
public interface PipelineStage {

    /**
     * Name reported when the stage fails.
     */
    String getName();

    /**
     * Runs the stage.
     *
     * @param previousOutput file id written by the previous stage, or {@code null} for the first stage.
     * @return the file id this stage wrote.
     */
    String run(String previousOutput);
}
