package com.image.ai.pipeline.model;

import com.image.ai.shared.util.constants.AppConstants;

/**
 * Persisted lifecycle of an image. {@code PROCESSING} is the only non-terminal
 * value; an item never returns to it once it reached a terminal status.
 */
public enum ImageStatus {
    PROCESSING(AppConstants.STATUS_PROCESSING),
    SUCCEEDED(AppConstants.STATUS_SUCCESS),
    FAILED(AppConstants.STATUS_FAILED);

    private final String token;

    ImageStatus(String token) {
        this.token = token;
    }

    /** Lowercase token used on the wire. */
    public String token() {
        return token;
    }

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
