package com.image.ai.pipeline.derivation;

import java.awt.image.BufferedImage;

/** Aspect-preserving downscale into a bounding box; never upscales. */
public interface ImageResizer {

    BufferedImage resize(BufferedImage image, int maxWidth, int maxHeight);
}
