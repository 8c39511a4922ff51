package com.image.ai.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ImageCreateResponse(
        @JsonProperty("image_id") String imageId,
        String status
) {}
