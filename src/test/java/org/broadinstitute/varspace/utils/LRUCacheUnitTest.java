package org.broadinstitute.varspace.utils;

import org.broadinstitute.varspace.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;

public final class LRUCacheUnitTest extends BaseTest {

    @Test
    public void testEvictsLeastRecentlyUsed() {
        final LRUCache<String, Integer> cache = new LRUCache<>(2);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");
        cache.put("c", 3);
        Assert.assertEquals(new ArrayList<>(cache.keySet()), Arrays.asList("a", "c"));
        Assert.assertEquals(cache.getMaxCapacity(), 2);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCapacityMustBePositive() {
        new LRUCache<String, Integer>(0);
    }
}
