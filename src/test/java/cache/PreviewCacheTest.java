package cache;

import image.Rgba8Buffer;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class PreviewCacheTest {

    private static Rgba8Buffer buf(int w, int h) {
        return new Rgba8Buffer(w, h, new byte[w * h * 4]);
    }

    @Test
    public void identityIncludesDitherFlag() {
        assertNotEquals(PreviewCache.identity("abc", true), PreviewCache.identity("abc", false));
    }

    @Test
    public void evictsByByteBudget() {
        PreviewCache c = new PreviewCache(150);
        c.put("a", buf(4, 4));
        c.put("b", buf(4, 4));
        c.get("a");
        c.put("c", buf(4, 4));
        assertEquals(2, c.size());
        assertEquals(128, c.bytes());
        assertTrue(c.get("a").isPresent());
        assertFalse(c.get("b").isPresent());
    }

    @Test
    public void oversizedBufferIsNotStored() {
        PreviewCache c = new PreviewCache(100);
        assertFalse(c.put("big", buf(10, 10)));
        assertEquals(0, c.size());
    }

    @Test
    public void replacingAnIdentityKeepsAccountingExact() {
        PreviewCache c = new PreviewCache(1000);
        c.put("a", buf(4, 4));
        c.put("a", buf(2, 2));
        assertEquals(16, c.bytes());
        c.clear();
        assertEquals(0, c.bytes());
    }
}
