package cache;

import image.LinearImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import params.ParameterHash;
import pipeline.ProcessingStage;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;

/**
 * L2: outputs of cacheable stages, LRU by access, bounded by entry count.
 */
public final class StageCache {

    private static final Logger log = LoggerFactory.getLogger(StageCache.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final LinkedHashMap<StageCacheKey, StageCacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private volatile int maxEntries;
    private volatile CacheValidityChecker checker;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong corruptions = new AtomicLong();

    public StageCache(int maxEntries, boolean verifyOnHit) {
        if (maxEntries <= 0)
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        this.maxEntries = maxEntries;
        this.checker = new CacheValidityChecker(verifyOnHit);
    }

    public Optional<LinearImage> get(ProcessingStage stage, ParameterHash hash, String upstreamId) {
        StageCacheKey key = new StageCacheKey(stage, hash.digest(), upstreamId);
        StageCacheEntry entry;
        // access-ordered map: get() reorders, so it needs the write lock
        lock.writeLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.writeLock().unlock();
        }
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        switch (checker.check(entry, hash, upstreamId)) {
            case VALID -> {
                hits.incrementAndGet();
                return Optional.of(entry.image());
            }
            case CORRUPT -> {
                corruptions.incrementAndGet();
                log.warn("Cache entry {} failed its checksum, dropping it", key);
                remove(key, entry);
            }
            case STALE -> log.debug("Stale cache entry {} (digest collision or upstream mismatch)", key);
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    public boolean contains(ProcessingStage stage, ParameterHash hash, String upstreamId) {
        lock.readLock().lock();
        try {
            return entries.containsKey(new StageCacheKey(stage, hash.digest(), upstreamId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(ProcessingStage stage, ParameterHash hash, String upstreamId, LinearImage image) {
        putIfCurrent(stage, hash, upstreamId, image, () -> true);
    }

    /**
     * Store only if {@code stillCurrent} holds when the write lock is taken.
     *
     * @return whether the entry was stored
     */
    public boolean putIfCurrent(ProcessingStage stage, ParameterHash hash, String upstreamId, LinearImage image,
                                BooleanSupplier stillCurrent) {
        StageCacheKey key = new StageCacheKey(stage, hash.digest(), upstreamId);
        StageCacheEntry entry = StageCacheEntry.of(key, hash, image);
        lock.writeLock().lock();
        try {
            if (!stillCurrent.getAsBoolean()) {
                log.debug("Skipping cache write for superseded render {}", key);
                return false;
            }
            entries.put(key, entry);
            trim(maxEntries);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drop every entry for {@code stage} and the stages after it. */
    public int invalidateFrom(ProcessingStage stage) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<StageCacheKey> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().stage().order() >= stage.order()) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Evict up to {@code count} least recently used entries. */
    public int evictOldest(int count) {
        lock.writeLock().lock();
        try {
            return trim(Math.max(0, entries.size() - count));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setMaxEntries(int maxEntries) {
        if (maxEntries <= 0)
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        lock.writeLock().lock();
        try {
            this.maxEntries = maxEntries;
            trim(maxEntries);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setVerifyOnHit(boolean verify) {
        this.checker = new CacheValidityChecker(verify);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long bytes() {
        lock.readLock().lock();
        try {
            long sum = 0;
            for (StageCacheEntry e : entries.values())
                sum += e.byteSize();
            return sum;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int maxEntries() {
        return maxEntries;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }

    public long corruptions() {
        return corruptions.get();
    }

    public void resetStats() {
        hits.set(0);
        misses.set(0);
        evictions.set(0);
        corruptions.set(0);
    }

    /** Snapshot of an entry for inspection; does not touch LRU order. */
    Optional<StageCacheEntry> peek(StageCacheKey key) {
        lock.readLock().lock();
        try {
            for (Map.Entry<StageCacheKey, StageCacheEntry> e : entries.entrySet()) {
                if (e.getKey().equals(key))
                    return Optional.of(e.getValue());
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void remove(StageCacheKey key, StageCacheEntry expected) {
        lock.writeLock().lock();
        try {
            entries.remove(key, expected);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private int trim(int limit) {
        int evicted = 0;
        Iterator<StageCacheKey> it = entries.keySet().iterator();
        while (entries.size() > limit && it.hasNext()) {
            it.next();
            it.remove();
            evicted++;
        }
        evictions.addAndGet(evicted);
        return evicted;
    }
}
