package backend.page;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;
import org.lupenghan.holodsm.backend.PageManager.Impl.PageImpl;
import org.lupenghan.holodsm.backend.PageManager.Impl.TwoQueuePageCache;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.PageManager.PageCache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TwoQueuePageCacheTest {
    private static final String ARRAY = "array-1";

    private PageCache cache;

    @Before
    public void setUp() {
        cache = new TwoQueuePageCache(2);
    }

    private static Page page(String arrayId, int pageId) {
        return new PageImpl(new PageKey(arrayId, pageId), 64, 1);
    }

    @Test
    public void testPutGet() {
        Page page = page(ARRAY, 0);
        cache.put(ARRAY, 0, page);
        assertSame(page, cache.get(ARRAY, 0));
        assertNull(cache.get(ARRAY, 1));
        assertNull(cache.get("array-2", 0));
        assertEquals(2, cache.capacity());
    }

    @Test
    public void testOldestSingleTouchEvictedFirst() {
        cache.put(ARRAY, 0, page(ARRAY, 0));
        cache.put(ARRAY, 1, page(ARRAY, 1));
        cache.put(ARRAY, 2, page(ARRAY, 2));

        assertEquals(2, cache.size());
        assertFalse(cache.contains(ARRAY, 0));
        assertTrue(cache.contains(ARRAY, 1));
        assertTrue(cache.contains(ARRAY, 2));
    }

    @Test
    public void testRetouchedPageRetained() {
        cache.put(ARRAY, 0, page(ARRAY, 0));
        cache.put(ARRAY, 1, page(ARRAY, 1));
        cache.get(ARRAY, 0);
        cache.put(ARRAY, 2, page(ARRAY, 2));

        assertTrue(cache.contains(ARRAY, 0));
        assertFalse(cache.contains(ARRAY, 1));
        assertTrue(cache.contains(ARRAY, 2));
    }

    @Test
    public void testContainsDoesNotPromote() {
        cache.put(ARRAY, 0, page(ARRAY, 0));
        cache.put(ARRAY, 1, page(ARRAY, 1));
        assertTrue(cache.contains(ARRAY, 0));
        cache.put(ARRAY, 2, page(ARRAY, 2));

        assertFalse(cache.contains(ARRAY, 0));
    }

    @Test
    public void testReplaceKeepsSize() {
        Page first = page(ARRAY, 0);
        Page second = page(ARRAY, 0);
        cache.put(ARRAY, 0, first);
        cache.put(ARRAY, 0, second);

        assertEquals(1, cache.size());
        assertSame(second, cache.get(ARRAY, 0));
    }

    @Test
    public void testRemoveAndRemoveIf() {
        PageCache big = new TwoQueuePageCache(10);
        for (int i = 0; i < 4; i++) {
            big.put(ARRAY, i, page(ARRAY, i));
        }
        big.put("other", 0, page("other", 0));

        assertTrue(big.remove(ARRAY, 3));
        assertFalse(big.remove(ARRAY, 3));

        int removed = big.removeIf(key -> key.getArrayId().equals(ARRAY));
        assertEquals(3, removed);
        assertEquals(1, big.size());
        assertTrue(big.contains("other", 0));
    }
}
