package com.image.ai.pipeline.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ThumbnailVariant {
    SMALL("small", 256, 256, 0.85f),
    MEDIUM("medium", 512, 512, 0.90f);

    private final String variantName;
    private final int maxWidth;
    private final int maxHeight;
    private final float quality;

    ThumbnailVariant(String variantName, int maxWidth, int maxHeight, float quality) {
        this.variantName = variantName;
        this.maxWidth = maxWidth;
        this.maxHeight = maxHeight;
        this.quality = quality;
    }

    public String variantName() {
        return variantName;
    }

    public int maxWidth() {
        return maxWidth;
    }

    public int maxHeight() {
        return maxHeight;
    }

    /** JPEG compression quality, 0..1. */
    public float quality() {
        return quality;
    }

    public static Optional<ThumbnailVariant> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.variantName.equals(normalized))
                .findFirst();
    }
}
