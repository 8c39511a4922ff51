package com.image.ai.pipeline.derivation;

import java.awt.image.BufferedImage;

/**
 * A decoded raster plus the format name reported by the decoder, upper-cased
 * (e.g. {@code JPEG}, {@code PNG}).
 */
public record DecodedImage(BufferedImage image, String formatName) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
