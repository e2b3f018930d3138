package cache;

import image.LinearImage;
import params.ParameterHash;

/**
 * One cached stage output. The checksum is taken when the entry is stored and compared
 * again on hit when verification is on.
 */
public record StageCacheEntry(StageCacheKey key, ParameterHash paramHash, LinearImage image, long checksum,
                              long byteSize, long createdAtMillis) {

    public static StageCacheEntry of(StageCacheKey key, ParameterHash hash, LinearImage image) {
        return new StageCacheEntry(key, hash, image, image.contentHash(), image.byteSize(), System.currentTimeMillis());
    }
}
