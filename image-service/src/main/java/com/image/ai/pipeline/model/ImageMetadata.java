package com.image.ai.pipeline.model;

import java.util.Locale;

/**
 * Result of the metadata stage. {@code format} keeps the encoder's canonical
 * name (e.g. {@code JPEG}); {@link #clientFormat(String)} gives the token shown
 * to clients.
 */
public record ImageMetadata(int width, int height, String format, long sizeBytes) {

    public static String clientFormat(String format) {
        if (format == null) {
            return "";
        }
        String lower = format.toLowerCase(Locale.ROOT);
        return "jpeg".equals(lower) ? "jpg" : lower;
    }
}
