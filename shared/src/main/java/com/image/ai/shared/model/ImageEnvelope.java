package com.image.ai.shared.model;

public record ImageEnvelope(
        String status,
        ImageData data,
        String error
) {}
