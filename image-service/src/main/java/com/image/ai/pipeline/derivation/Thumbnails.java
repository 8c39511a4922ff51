package com.image.ai.pipeline.derivation;

import com.image.ai.pipeline.model.ThumbnailVariant;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Encoded JPEG bytes for every {@link ThumbnailVariant}. */
public record Thumbnails(Map<ThumbnailVariant, byte[]> encoded) {

    public Thumbnails {
        for (ThumbnailVariant variant : ThumbnailVariant.values()) {
            if (encoded.get(variant) == null) {
                throw new IllegalArgumentException("missing thumbnail variant " + variant.variantName());
            }
        }
        encoded = Collections.unmodifiableMap(new EnumMap<>(encoded));
    }

    public byte[] bytes(ThumbnailVariant variant) {
        return encoded.get(variant);
    }
}
