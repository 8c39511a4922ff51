package com.image.ai.pipeline.derivation;

/** Derivation stages in execution order. */
public enum PipelineStage {
    DECODE("decode"),
    METADATA("metadata extraction"),
    THUMBNAILS("thumbnail generation"),
    CAPTION("caption generation"),
    STORE_THUMBNAILS("thumbnail storage");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
