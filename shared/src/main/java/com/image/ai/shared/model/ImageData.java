package com.image.ai.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Client view of one image. {@code metadata} and {@code thumbnails} are empty
 * maps unless processing succeeded.
 */
public record ImageData(
        @JsonProperty("image_id") String imageId,
        @JsonProperty("original_name") String originalName,
        @JsonProperty("processed_at") String processedAt,
        Map<String, Object> metadata,
        Map<String, String> thumbnails
) {}
