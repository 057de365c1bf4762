package org.broadinstitute.varspace.merge;

import org.broadinstitute.varspace.exceptions.UserException;

import java.util.Locale;

/**
 * The part a source table plays in a merge. Declaration order is merge priority: keys are emitted in the order
 * first seen iterating {@code PRIMARY}, then {@code SECONDARY}, {@code TERTIARY} and {@code CUSTOM}.
 */
public enum SourceRole {
    PRIMARY,
    SECONDARY,
    TERTIARY,
    CUSTOM;

    /**
     * Lower-case name used to namespace output columns, e.g. {@code primary.Position}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String namespace(final String column) {
        return label() + "." + column;
    }

    public String countColumn() {
        return label() + "_count";
    }

    public static SourceRole fromName(final String name) {
        for (final SourceRole role : values()) {
            if (role.label().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return role;
            }
        }
        throw new UserException.ValidationError("unknown source role: " + name);
    }
}
