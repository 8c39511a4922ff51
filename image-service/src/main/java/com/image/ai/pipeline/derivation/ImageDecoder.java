package com.image.ai.pipeline.derivation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

@Slf4j
@Component
public class ImageDecoder {

    public DecodedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new StageFailureException(PipelineStage.DECODE, "image payload is empty");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new StageFailureException(PipelineStage.DECODE, "cannot identify image file");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toUpperCase(Locale.ROOT);
                log.debug("Decoded {}x{} {} image", image.getWidth(), image.getHeight(), format);
                return new DecodedImage(image, format);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof StageFailureException stageFailure) {
                throw stageFailure;
            }
            throw new StageFailureException(PipelineStage.DECODE,
                    "cannot decode image: " + StageFailureException.reasonOf(e), e);
        }
    }
}
