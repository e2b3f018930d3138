package io;

import image.LinearImage;

/** Full-resolution decode result. */
public record DecodedSource(LinearImage image, SourceMetadata metadata) {
}
