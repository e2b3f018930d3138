package cache;

import params.ParameterHash;

/** Decides whether a stored stage output may be reused for the current request. */
public final class CacheValidityChecker {

    public enum Validity {
        VALID,
        /** Parameters or upstream changed; harmless miss. */
        STALE,
        /** Stored pixels no longer match their checksum. */
        CORRUPT
    }

    private final boolean verifyChecksum;

    public CacheValidityChecker(boolean verifyChecksum) {
        this.verifyChecksum = verifyChecksum;
    }

    public boolean verifiesChecksum() {
        return verifyChecksum;
    }

    public Validity check(StageCacheEntry entry, ParameterHash current, String upstreamId) {
        if (entry == null)
            return Validity.STALE;
        if (!entry.paramHash().matches(current))
            return Validity.STALE;
        if (!entry.key().upstreamId().equals(upstreamId))
            return Validity.STALE;
        if (verifyChecksum && entry.image().contentHash() != entry.checksum())
            return Validity.CORRUPT;
        return Validity.VALID;
    }
}
