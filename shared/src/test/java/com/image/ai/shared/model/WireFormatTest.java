package com.image.ai.shared.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Client-facing JSON field names")
class WireFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("create response uses image_id")
    void createResponse_snakeCase() {
        JsonNode json = objectMapper.valueToTree(new ImageCreateResponse("abc", "processing"));

        assertThat(json.get("image_id").asText()).isEqualTo("abc");
        assertThat(json.get("status").asText()).isEqualTo("processing");
        assertThat(json.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("envelope keeps a null error and snake_case data fields")
    void envelope_shape() {
        ImageEnvelope envelope = new ImageEnvelope("processing",
                new ImageData("abc", "cat.jpg", null, Map.of(), Map.of()), null);

        JsonNode json = objectMapper.valueToTree(envelope);

        assertThat(json.has("error")).isTrue();
        assertThat(json.get("error").isNull()).isTrue();
        assertThat(json.get("data").get("original_name").asText()).isEqualTo("cat.jpg");
        assertThat(json.get("data").get("processed_at").isNull()).isTrue();
        assertThat(json.get("data").get("metadata").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("stats expose success_rate and average_processing_time_seconds")
    void stats_snakeCase() {
        JsonNode json = objectMapper.valueToTree(new StatsResponse(4, 1, "75.00%", 1.25));

        assertThat(json.get("total").asLong()).isEqualTo(4);
        assertThat(json.get("failed").asLong()).isEqualTo(1);
        assertThat(json.get("success_rate").asText()).isEqualTo("75.00%");
        assertThat(json.get("average_processing_time_seconds").asDouble()).isEqualTo(1.25);
    }

    @Test
    @DisplayName("error bodies omit the empty data field")
    void apiError_omitsData() {
        JsonNode json = objectMapper.valueToTree(ApiResponse.error("Image not found."));

        assertThat(json.get("status").asText()).isEqualTo("error");
        assertThat(json.get("message").asText()).isEqualTo("Image not found.");
        assertThat(json.has("data")).isFalse();
    }
}
