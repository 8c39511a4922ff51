package com.image.ai.pipeline.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The single terminal write of an item. Built only through
 * {@link #succeeded} or {@link #failed}, so a completion can never mix success
 * fields with an error.
 */
public record ItemCompletion(
        ImageStatus status,
        Integer width,
        Integer height,
        String format,
        String caption,
        Map<String, String> thumbnailRefs,
        String error,
        Instant completedAt,
        long processingDurationMs
) {

    public static ItemCompletion succeeded(ImageMetadata metadata, String caption,
                                           Map<String, String> thumbnailRefs,
                                           Instant completedAt, long processingDurationMs) {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(caption, "caption");
        for (ThumbnailVariant variant : ThumbnailVariant.values()) {
            if (thumbnailRefs == null || thumbnailRefs.get(variant.variantName()) == null) {
                throw new IllegalArgumentException("missing thumbnail ref: " + variant.variantName());
            }
        }
        return new ItemCompletion(ImageStatus.SUCCEEDED, metadata.width(), metadata.height(),
                metadata.format(), caption, Map.copyOf(thumbnailRefs), null,
                completedAt, processingDurationMs);
    }

    public static ItemCompletion failed(String error, Instant completedAt, long processingDurationMs) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error message must not be blank");
        }
        return new ItemCompletion(ImageStatus.FAILED, null, null, null, null, null, error,
                completedAt, processingDurationMs);
    }

    /** Terminal copy of a processing item; immutable acceptance fields are kept. */
    public ImageItem applyTo(ImageItem processing) {
        return processing.toBuilder()
                .status(status)
                .width(width)
                .height(height)
                .format(format)
                .caption(caption)
                .thumbnailRefs(thumbnailRefs)
                .error(error)
                .completedAt(completedAt)
                .processingDurationMs(processingDurationMs)
                .build();
    }
}
