package org.broadinstitute.varspace.pipeline;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.merge.JoinPreset;
import org.broadinstitute.varspace.merge.MergeEngine;
import org.broadinstitute.varspace.merge.SourceRole;
import org.broadinstitute.varspace.utils.Utils;

import java.util.EnumMap;
import java.util.Map;

/**
 * Merges a fixed set of sources, plus the previous stage's output under {@code previousOutputRole} if one is
 * given.
 */
public final class MergeStage implements PipelineStage {

    private final MergeEngine engine;
    private final String savePath;
    private final Map<SourceRole, String> fixedSources;
    private final SourceRole previousOutputRole;
    private final JoinPreset preset;
    private final boolean override;

    /**
     * @param previousOutputRole role of the previous output in the merge; {@code null} to merge only
     *                           {@code fixedSources}.
     * @param preset             preset the sources must fit; {@code null} for none.
     */
    public MergeStage(final MergeEngine engine, final String savePath, final Map<SourceRole, String> fixedSources,
                      final SourceRole previousOutputRole, final JoinPreset preset, final boolean override) {
        this.engine = Utils.nonNull(engine, "the merge engine cannot be null");
        this.savePath = Utils.nonNull(savePath, "the save path cannot be null");
        this.fixedSources = Utils.nonNull(fixedSources, "the fixed sources cannot be null").isEmpty() ? new EnumMap<>(SourceRole.class) : new EnumMap<>(fixedSources);
        Utils.validateArg(previousOutputRole == null || !this.fixedSources.containsKey(previousOutputRole),
                () -> "role " + previousOutputRole + " is already taken by a fixed source");
        this.previousOutputRole = previousOutputRole;
        this.preset = preset;
        this.override = override;
    }

    @Override
    public String getName() {
        return "merge into " + savePath;
    }

    @Override
    public String run(final String previousOutput) {
        final Map<SourceRole, String> sources = new EnumMap<>(SourceRole.class);
        sources.putAll(fixedSources);
        if (previousOutputRole != null) {
            if (previousOutput == null) {
                throw new UserException.ValidationError(getName() + " expects the output of a previous stage");
            }
            sources.put(previousOutputRole, previousOutput);
        }
        return preset == null
                ? engine.mergeSources(savePath, sources, override).getFileId()
                : engine.mergeSources(savePath, sources, override, preset).getFileId();
    }
}
