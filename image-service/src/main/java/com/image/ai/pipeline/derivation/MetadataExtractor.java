package com.image.ai.pipeline.derivation;

import com.image.ai.pipeline.model.ImageMetadata;
import org.springframework.stereotype.Component;

@Component
public class MetadataExtractor {

    public ImageMetadata extract(DecodedImage decoded, long sizeBytes) {
        if (decoded.width() <= 0 || decoded.height() <= 0) {
            throw new StageFailureException(PipelineStage.METADATA,
                    "invalid dimensions " + decoded.width() + "x" + decoded.height());
        }
        if (decoded.formatName() == null || decoded.formatName().isBlank()) {
            throw new StageFailureException(PipelineStage.METADATA, "decoder reported no format");
        }
        return new ImageMetadata(decoded.width(), decoded.height(), decoded.formatName(), sizeBytes);
    }
}
