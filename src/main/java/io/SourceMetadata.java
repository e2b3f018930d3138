package io;

import util.CfaPattern;

import java.util.Optional;

/**
 * What the decoder learned about a source before any preview downscale.
 *
 * @param cfaPattern Bayer layout for mosaic sources, {@code null} otherwise
 */
public record SourceMetadata(SourceFormat format, int originalWidth, int originalHeight, int bitsPerSample,
                             CfaPattern cfaPattern) {

    public enum SourceFormat {
        RASTER, RAW_PREVIEW, BAYER_MOSAIC
    }

    public Optional<CfaPattern> cfa() {
        return Optional.ofNullable(cfaPattern);
    }

    public boolean isMosaic() {
        return format == SourceFormat.BAYER_MOSAIC;
    }
}
