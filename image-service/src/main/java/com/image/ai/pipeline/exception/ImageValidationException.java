package com.image.ai.pipeline.exception;

import lombok.Getter;

@Getter
public class ImageValidationException extends RuntimeException {

    private final String errorCode;

    public ImageValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
