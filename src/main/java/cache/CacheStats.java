package cache;

/** Point-in-time counters of the three cache levels. */
public record CacheStats(int l1Entries, long l1Bytes, long l1Hits, long l1Misses,
                         int l2Entries, long l2Bytes, long l2Hits, long l2Misses, long l2Evictions,
                         long l2Corruptions, boolean sourceLoaded) {

    public double l2HitRate() {
        long total = l2Hits + l2Misses;
        return total == 0 ? 0.0 : (double) l2Hits / total;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT,
                "L1 %d entries / %.1f MB (hits %d, misses %d); L2 %d entries / %.1f MB (hits %d, misses %d, "
                        + "evicted %d, corrupt %d, hit rate %.0f%%); L3 %s",
                l1Entries, l1Bytes / (1024.0 * 1024.0), l1Hits, l1Misses,
                l2Entries, l2Bytes / (1024.0 * 1024.0), l2Hits, l2Misses, l2Evictions, l2Corruptions,
                l2HitRate() * 100, sourceLoaded ? "loaded" : "empty");
    }
}
