package com.image.ai.pipeline.exception;

public class PipelineUnavailableException extends RuntimeException {
    public PipelineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
