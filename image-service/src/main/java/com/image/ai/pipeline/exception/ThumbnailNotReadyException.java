package com.image.ai.pipeline.exception;

import com.image.ai.pipeline.model.ImageStatus;
import lombok.Getter;

@Getter
public class ThumbnailNotReadyException extends RuntimeException {

    private final ImageStatus currentStatus;

    public ThumbnailNotReadyException(String message, ImageStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }
}
