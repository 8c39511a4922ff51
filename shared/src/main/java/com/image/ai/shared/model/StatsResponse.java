package com.image.ai.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatsResponse(
        long total,
        long failed,
        @JsonProperty("success_rate") String successRate,
        @JsonProperty("average_processing_time_seconds") double averageProcessingTimeSeconds
) {}
