package org.broadinstitute.varspace.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a {@link Pipeline} run: the outputs of the stages that completed and, if a stage failed, which
 * one and why.
 */
public final class PipelineResult {

    private final List<String> completedOutputs;
    private final String failedStage;
    private final RuntimeException cause;

    private PipelineResult(final List<String> completedOutputs, final String failedStage, final RuntimeException cause) {
        this.completedOutputs = Collections.unmodifiableList(new ArrayList<>(completedOutputs));
        this.failedStage = failedStage;
        this.cause = cause;
    }

    static PipelineResult success(final List<String> outputs) {
        return new PipelineResult(outputs, null, null);
    }

    static PipelineResult failure(final List<String> outputs, final String failedStage, final RuntimeException cause) {
        return new PipelineResult(outputs, failedStage, cause);
    }

    public boolean isSuccess() {
        return failedStage == null;
    }

    /**
     * File ids written by the completed stages, in stage order.
     */
    public List<String> getCompletedOutputs() {
        return completedOutputs;
    }

    /**
     * Output of the last completed stage.
     */
    public Optional<String> getLastOutput() {
        return completedOutputs.isEmpty() ? Optional.empty() : Optional.of(completedOutputs.get(completedOutputs.size() - 1));
    }

    public Optional<String> getFailedStage() {
        return Optional.ofNullable(failedStage);
    }

    public Optional<RuntimeException> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "PipelineResult{success, outputs=" + completedOutputs + "}"
                : "PipelineResult{failed at '" + failedStage + "', outputs=" + completedOutputs + ", cause=" + cause.getMessage() + "}";
    }
}
