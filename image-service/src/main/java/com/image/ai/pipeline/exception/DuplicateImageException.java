package com.image.ai.pipeline.exception;

public class DuplicateImageException extends ImageStoreException {
    public DuplicateImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
