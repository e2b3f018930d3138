package cache;

import image.Rgba8Buffer;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * L1: display-ready RGBA8 previews keyed by render identity, LRU within a byte budget.
 */
public final class PreviewCache {

    private final LinkedHashMap<String, Rgba8Buffer> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long maxBytes;
    private long bytes;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public PreviewCache(long maxBytes) {
        if (maxBytes <= 0)
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        this.maxBytes = maxBytes;
    }

    /** Render identity: final upstream id plus the dither flag. */
    public static String identity(String finalUpstreamId, boolean dither) {
        return finalUpstreamId + (dither ? ":d" : ":n");
    }

    public synchronized Optional<Rgba8Buffer> get(String identity) {
        Rgba8Buffer buf = entries.get(identity);
        if (buf == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(buf);
    }

    /** Buffers larger than the whole budget are not stored. */
    public synchronized boolean put(String identity, Rgba8Buffer buf) {
        long size = buf.byteSize();
        if (size > maxBytes)
            return false;
        Rgba8Buffer old = entries.put(identity, buf);
        if (old != null)
            bytes -= old.byteSize();
        bytes += size;
        trim();
        return true;
    }

    public synchronized void clear() {
        entries.clear();
        bytes = 0;
    }

    public synchronized void setMaxBytes(long maxBytes) {
        if (maxBytes <= 0)
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        this.maxBytes = maxBytes;
        trim();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long bytes() {
        return bytes;
    }

    public synchronized long maxBytes() {
        return maxBytes;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private void trim() {
        Iterator<Map.Entry<String, Rgba8Buffer>> it = entries.entrySet().iterator();
        while (bytes > maxBytes && it.hasNext()) {
            bytes -= it.next().getValue().byteSize();
            it.remove();
        }
    }
}
