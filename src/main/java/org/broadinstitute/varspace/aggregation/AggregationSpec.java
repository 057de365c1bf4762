package org.broadinstitute.varspace.aggregation;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered mapping from column name to the aggregation shown for it, with the last computed value if any.
 */
public final class AggregationSpec {

    private final Map<String, Entry> entries;

    private AggregationSpec(final Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static AggregationSpec empty() {
        return new AggregationSpec(Collections.emptyMap());
    }

    /**
     * Returns a new spec with {@code action} set on {@code column}, discarding any cached value for it.
     */
    public AggregationSpec with(final String column, final AggregationAction action) {
        Utils.nonNull(column, "the column cannot be null");
        final Map<String, Entry> copy = new LinkedHashMap<>(entries);
        copy.put(column, new Entry(action, null));
        return new AggregationSpec(copy);
    }

    AggregationSpec withResult(final String column, final AggregationResult result) {
        final Entry entry = Utils.nonNull(entries.get(column), () -> "no aggregation on column " + column);
        final Map<String, Entry> copy = new LinkedHashMap<>(entries);
        copy.put(column, new Entry(entry.getAction(), result));
        return new AggregationSpec(copy);
    }

    AggregationSpec without(final String column) {
        final Map<String, Entry> copy = new LinkedHashMap<>(entries);
        copy.remove(column);
        return new AggregationSpec(copy);
    }

    public Map<String, Entry> entries() {
        return entries;
    }

    public Optional<AggregationResult> getResult(final String column) {
        final Entry entry = entries.get(column);
        return entry == null ? Optional.empty() : entry.getCachedValue();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof AggregationSpec && entries.equals(((AggregationSpec) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "AggregationSpec" + entries;
    }

    public static final class Entry {
        private final AggregationAction action;
        private final AggregationResult cachedValue;

        Entry(final AggregationAction action, final AggregationResult cachedValue) {
            this.action = Utils.nonNull(action, "the action cannot be null");
            this.cachedValue = cachedValue;
        }

        public AggregationAction getAction() {
            return action;
        }

        public Optional<AggregationResult> getCachedValue() {
            return Optional.ofNullable(cachedValue);
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            final Entry other = (Entry) o;
            return action == other.action && Objects.equals(cachedValue, other.cachedValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(action, cachedValue);
        }

        @Override
        public String toString() {
            return cachedValue == null ? action.toString() : cachedValue.toString();
        }
    }
}
