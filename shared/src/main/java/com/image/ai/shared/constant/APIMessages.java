package com.image.ai.shared.constant;

public final class APIMessages {

    private APIMessages() {
    }

    // ── Service ──
    public static final String API_WORKING = "API is working";

    // ── Upload ──
    public static final String ERROR_UNSUPPORTED_TYPE = "Only JPG and PNG are allowed.";
    public static final String ERROR_EMPTY_UPLOAD = "Empty upload.";
    public static final String ERROR_UPLOAD_TOO_LARGE = "Upload exceeds the maximum allowed size.";
    public static final String ERROR_DUPLICATE_IMAGE = "Image id already exists: ";

    // ── Query ──
    public static final String ERROR_IMAGE_NOT_FOUND = "Image not found.";
    public static final String ERROR_THUMBNAIL_NOT_FOUND = "Thumbnail not found.";
    public static final String ERROR_THUMBNAILS_NOT_READY = "Thumbnails not ready (processing not successful).";
    public static final String ERROR_INVALID_THUMBNAIL_SIZE = "size must be 'small' or 'medium'.";

    // ── Generic ──
    public static final String ERROR_PIPELINE_UNAVAILABLE = "Image processing is shutting down. Please try again later.";
    public static final String ERROR_STORAGE = "Storage is temporarily unavailable. Please try again later.";
}
