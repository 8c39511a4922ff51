package com.image.ai.pipeline.derivation;

import com.image.ai.pipeline.TestImages;
import com.image.ai.pipeline.model.ImageMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ImageDecoder and MetadataExtractor Unit Tests")
class ImageDecoderTest {

    private final ImageDecoder decoder = new ImageDecoder();
    private final MetadataExtractor extractor = new MetadataExtractor();

    @Test
    @DisplayName("decode: JPEG keeps the encoder's canonical format name")
    void decode_jpeg() {
        DecodedImage decoded = decoder.decode(TestImages.jpeg(40, 30));

        assertThat(decoded.formatName()).isEqualTo("JPEG");
        assertThat(decoded.width()).isEqualTo(40);
        assertThat(decoded.height()).isEqualTo(30);
    }

    @Test
    @DisplayName("decode: PNG is reported as PNG")
    void decode_png() {
        assertThat(decoder.decode(TestImages.png(10, 20)).formatName()).isEqualTo("PNG");
    }

    @Test
    @DisplayName("decode: bytes that are no image fail the DECODE stage")
    void decode_garbage_fails() {
        byte[] garbage = "definitely not an image".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> decoder.decode(garbage))
                .isInstanceOf(StageFailureException.class)
                .satisfies(e -> assertThat(((StageFailureException) e).getStage()).isEqualTo(PipelineStage.DECODE))
                .hasMessageContaining("cannot identify image file");
    }

    @Test
    @DisplayName("decode: empty payload fails the DECODE stage")
    void decode_empty_fails() {
        assertThatThrownBy(() -> decoder.decode(new byte[0]))
                .isInstanceOf(StageFailureException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("extract: dimensions, internal format and size are reported")
    void extract_metadata() {
        ImageMetadata metadata = extractor.extract(decoder.decode(TestImages.jpeg(64, 48)), 777L);

        assertThat(metadata.width()).isEqualTo(64);
        assertThat(metadata.height()).isEqualTo(48);
        assertThat(metadata.format()).isEqualTo("JPEG");
        assertThat(metadata.sizeBytes()).isEqualTo(777L);
        assertThat(ImageMetadata.clientFormat(metadata.format())).isEqualTo("jpg");
    }

    @Test
    @DisplayName("StageFailureException.describe: prefixes the stage label")
    void stageFailure_describe() {
        StageFailureException e = new StageFailureException(PipelineStage.CAPTION, "model offline");

        assertThat(e.describe()).isEqualTo("caption generation failed: model offline");
    }
}
