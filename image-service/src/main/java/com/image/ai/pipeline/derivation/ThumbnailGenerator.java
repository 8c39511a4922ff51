package com.image.ai.pipeline.derivation;

import com.image.ai.pipeline.model.ThumbnailVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Produces every thumbnail variant in memory. Nothing is written to the blob
 * store here; the pipeline persists the set only once all stages succeeded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThumbnailGenerator {

    static final String OUTPUT_FORMAT = "jpeg";

    private final ImageResizer resizer;

    public Thumbnails generate(DecodedImage decoded) {
        Map<ThumbnailVariant, byte[]> encoded = new EnumMap<>(ThumbnailVariant.class);
        for (ThumbnailVariant variant : ThumbnailVariant.values()) {
            try {
                BufferedImage resized = resizer.resize(decoded.image(), variant.maxWidth(), variant.maxHeight());
                encoded.put(variant, encodeJpeg(resized, variant.quality()));
                log.debug("Generated {} thumbnail {}x{}", variant.variantName(), resized.getWidth(), resized.getHeight());
            } catch (IOException | RuntimeException e) {
                throw new StageFailureException(PipelineStage.THUMBNAILS,
                        "cannot create " + variant.variantName() + " thumbnail: "
                                + StageFailureException.reasonOf(e), e);
            }
        }
        return new Thumbnails(encoded);
    }

    static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(OUTPUT_FORMAT);
        if (!writers.hasNext()) {
            throw new IOException("no JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.setOutput(output);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
