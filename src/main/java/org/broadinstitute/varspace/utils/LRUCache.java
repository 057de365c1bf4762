package org.broadinstitute.varspace.utils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An LRU cache implemented as an extension to LinkedHashMap
 */
public final class LRUCache<K,V> extends LinkedHashMap<K,V> {

    private static final long serialVersionUID = 1L;
    private final int maxCapacity; // Maximum number of items in the cache.

    public LRUCache(final int maxCapacity) {
        super(Math.min(maxCapacity, 1 << 16) + 1, 1.0f, true); // access order
        Utils.validateArg(maxCapacity > 0, "the cache capacity must be positive");
        this.maxCapacity = maxCapacity;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    @Override
    protected boolean removeEldestEntry(final Map.Entry<K,V> entry) {
        return size() > this.maxCapacity;
    }
}
