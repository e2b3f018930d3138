package stages;

import image.LinearImage;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Memoizes bilateral outputs by (input content hash, σs, σr).
 * Least recently used entries go first once either the entry or the byte limit is hit.
 */
public final class BilateralResultCache {

    record Key(long contentHash, int width, int height, float spatialSigma, float rangeSigma) {
    }

    private final int maxEntries;
    private final long maxBytes;
    private final LinkedHashMap<Key, LinearImage> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long bytes;

    public BilateralResultCache(int maxEntries, long maxMemoryMb) {
        if (maxEntries <= 0 || maxMemoryMb <= 0)
            throw new IllegalArgumentException("cache limits must be positive");
        this.maxEntries = maxEntries;
        this.maxBytes = maxMemoryMb * 1024L * 1024L;
    }

    static Key keyFor(LinearImage input, float spatialSigma, float rangeSigma) {
        return new Key(input.contentHash(), input.width(), input.height(), spatialSigma, rangeSigma);
    }

    public synchronized LinearImage get(Key key) {
        return entries.get(key);
    }

    public synchronized void put(Key key, LinearImage result) {
        long size = result.byteSize();
        if (size > maxBytes)
            return;
        LinearImage prev = entries.put(key, result);
        if (prev != null)
            bytes -= prev.byteSize();
        bytes += size;
        Iterator<Map.Entry<Key, LinearImage>> it = entries.entrySet().iterator();
        while ((entries.size() > maxEntries || bytes > maxBytes) && it.hasNext()) {
            Map.Entry<Key, LinearImage> eldest = it.next();
            if (eldest.getKey().equals(key))
                continue;
            bytes -= eldest.getValue().byteSize();
            it.remove();
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long bytes() {
        return bytes;
    }

    public synchronized void clear() {
        entries.clear();
        bytes = 0;
    }
}
