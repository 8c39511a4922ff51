package com.image.ai.pipeline.derivation;

import lombok.Getter;

@Getter
public class StageFailureException extends RuntimeException {

    private final PipelineStage stage;

    public StageFailureException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageFailureException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /** Message of {@code cause}, or its simple class name when it carries none. */
    public static String reasonOf(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    /** Human readable summary persisted as the item's error. */
    public String describe() {
        return stage.label() + " failed: " + getMessage();
    }
}
