package org.broadinstitute.varspace.query;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered mapping from column name to {@link SortDirection}.
 * <p>
 * The first entry is the primary sort key, the second breaks its ties and so forth. Rows that compare equal on
 * every entry keep their original relative order.
 * </p>
 */
public final class SortSpec {

    private static final SortSpec NONE = new SortSpec(Collections.emptyMap());

    private final Map<String, SortDirection> entries;

    private SortSpec(final Map<String, SortDirection> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static SortSpec none() {
        return NONE;
    }

    public static SortSpec by(final String column, final SortDirection direction) {
        return NONE.then(column, direction);
    }

    /**
     * Builds a spec from an ordered mapping; iteration order of {@code entries} gives the key priority.
     */
    public static SortSpec of(final Map<String, SortDirection> entries) {
        Utils.nonNull(entries, "the sort entries cannot be null");
        entries.forEach((column, direction) -> {
            Utils.nonNull(column, "sort column cannot be null");
            Utils.nonNull(direction, "sort direction cannot be null");
        });
        return new SortSpec(entries);
    }

    /**
     * Returns a new spec with an additional lower priority key.
     */
    public SortSpec then(final String column, final SortDirection direction) {
        Utils.nonNull(column, "sort column cannot be null");
        Utils.nonNull(direction, "sort direction cannot be null");
        Utils.validateArg(!entries.containsKey(column), () -> "column " + column + " is already a sort key");
        final Map<String, SortDirection> copy = new LinkedHashMap<>(entries);
        copy.put(column, direction);
        return new SortSpec(copy);
    }

    public Map<String, SortDirection> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof SortSpec && entries.equals(((SortSpec) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "SortSpec" + entries;
    }
}
