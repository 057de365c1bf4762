package org.broadinstitute.varspace.merge;

import org.broadinstitute.varspace.exceptions.UserException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Named combinations of sources a merge may be asked for.
 */
public enum JoinPreset {

    /** Any two sources. */
    PAIR {
        @Override
        public void validate(final Set<SourceRole> roles) {
            if (roles.size() != 2) {
                throw new UserException.ValidationError("a pair join needs exactly two sources but got " + roles);
            }
        }
    },

    /** Primary, secondary and tertiary sources, optionally with a custom one. */
    FULL {
        @Override
        public void validate(final Set<SourceRole> roles) {
            final Set<SourceRole> required = EnumSet.of(SourceRole.PRIMARY, SourceRole.SECONDARY, SourceRole.TERTIARY);
            if (!roles.containsAll(required)) {
                throw new UserException.ValidationError("a full join needs sources for " + required + " but got " + roles);
            }
        }
    };

    /**
     * @throws UserException.ValidationError if {@code roles} does not fit this preset.
     */
    public abstract void validate(Set<SourceRole> roles);
}
