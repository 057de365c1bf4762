package org.broadinstitute.varspace.aggregation;

import org.broadinstitute.varspace.exceptions.UserException;

import java.util.Locale;

/**
 * Column statistics that can be requested for a table view.
 */
public enum AggregationAction {
    SUM,
    AVG,
    MIN,
    MAX,
    /** Number of matching rows, whatever their cell content. */
    COUNT,
    /** Removes an aggregation from a spec; never computed. */
    NONE;

    /**
     * Whether the action reads cells as numbers and skips the ones that are not.
     */
    public boolean isNumeric() {
        return this != COUNT && this != NONE;
    }

    /**
     * Parses a lower- or upper-case action name.
     *
     * @throws UserException.ValidationError for an unknown name.
     */
    public static AggregationAction fromName(final String name) {
        if (name != null) {
            for (final AggregationAction action : values()) {
                if (action.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return action;
                }
            }
        }
        throw new UserException.ValidationError("unknown aggregation action: " + name);
    }
}
