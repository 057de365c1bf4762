package org.broadinstitute.varspace.query;

import org.broadinstitute.varspace.exceptions.UserException;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parses {@code asc}/{@code desc} in any case.
     *
     * @throws UserException.ValidationError for any other value.
     */
    public static SortDirection fromName(final String name) {
        if (name != null) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "asc": return ASC;
                case "desc": return DESC;
                default: break;
            }
        }
        throw new UserException.ValidationError("unknown sort direction: " + name);
    }
}
