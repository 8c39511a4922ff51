package com.image.ai.pipeline.service;

import com.image.ai.pipeline.derivation.CaptionGenerator;
import com.image.ai.pipeline.derivation.DecodedImage;
import com.image.ai.pipeline.derivation.ImageDecoder;
import com.image.ai.pipeline.derivation.MetadataExtractor;
import com.image.ai.pipeline.derivation.PipelineStage;
import com.image.ai.pipeline.derivation.StageFailureException;
import com.image.ai.pipeline.derivation.ThumbnailGenerator;
import com.image.ai.pipeline.derivation.Thumbnails;
import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageMetadata;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ItemCompletion;
import com.image.ai.pipeline.model.ThumbnailVariant;
import com.image.ai.pipeline.repository.ImageItemStore;
import com.image.ai.pipeline.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one image through decode, metadata, thumbnails and caption, then
 * performs the item's single terminal write.
 * <p>
 * Stage failures never escape {@link #run}; they become a {@code FAILED}
 * completion. Faults of the record store itself do escape, leaving the item in
 * {@code PROCESSING}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagePipelineCoordinator {

    private final ImageItemStore itemStore;
    private final BlobStore blobStore;
    private final ImageDecoder imageDecoder;
    private final MetadataExtractor metadataExtractor;
    private final ThumbnailGenerator thumbnailGenerator;
    private final CaptionGenerator captionGenerator;
    private final Clock clock;

    public void run(String imageId) {
        Optional<ImageItem> loaded = itemStore.findById(imageId);
        if (loaded.isEmpty()) {
            log.warn("Pipeline invoked for unknown image id: {}", imageId);
            return;
        }
        ImageItem item = loaded.get();
        if (item.getStatus() != ImageStatus.PROCESSING) {
            log.warn("Image {} is already {}, skipping pipeline run", imageId, item.getStatus());
            return;
        }

        long sizeBytes = item.getSizeBytes() > 0 ? item.getSizeBytes() : blobStore.size(item.getStoredRef());

        StopWatch stopWatch = new StopWatch(imageId);
        stopWatch.start();
        log.info("Starting pipeline for image {} ({} bytes)", imageId, sizeBytes);

        Map<ThumbnailVariant, String> storedThumbnails = new LinkedHashMap<>();
        ItemCompletion completion;
        try {
            DecodedImage decoded = decode(item);
            ImageMetadata metadata = metadataExtractor.extract(decoded, sizeBytes);
            Thumbnails thumbnails = thumbnailGenerator.generate(decoded);
            String caption = captionGenerator.describe(decoded);

            storeThumbnails(imageId, thumbnails, storedThumbnails);

            stopWatch.stop();
            completion = ItemCompletion.succeeded(metadata, caption, toRefs(storedThumbnails),
                    clock.instant(), stopWatch.getTotalTimeMillis());
        } catch (StageFailureException e) {
            log.error("Pipeline stage {} failed for image {}", e.getStage(), imageId, e);
            completion = failed(stopWatch, e.describe());
            discard(imageId, storedThumbnails);
        } catch (RuntimeException | Error e) {
            // errors such as OutOfMemoryError on an oversized image still end the item as FAILED
            log.error("Unexpected pipeline error for image {}", imageId, e);
            completion = failed(stopWatch, "processing failed: " + StageFailureException.reasonOf(e));
            discard(imageId, storedThumbnails);
        }

        boolean applied;
        try {
            applied = itemStore.complete(imageId, completion);
        } catch (RuntimeException e) {
            discard(imageId, storedThumbnails);
            throw e;
        }
        if (!applied) {
            discard(imageId, storedThumbnails);
            return;
        }
        log.info("Image {} finished as {} in {} ms", imageId, completion.status(), completion.processingDurationMs());
    }

    private DecodedImage decode(ImageItem item) {
        byte[] bytes;
        try {
            bytes = blobStore.read(item.getStoredRef());
        } catch (RuntimeException e) {
            throw new StageFailureException(PipelineStage.DECODE,
                    "cannot read original: " + StageFailureException.reasonOf(e), e);
        }
        return imageDecoder.decode(bytes);
    }

    private void storeThumbnails(String imageId, Thumbnails thumbnails, Map<ThumbnailVariant, String> stored) {
        for (ThumbnailVariant variant : ThumbnailVariant.values()) {
            try {
                stored.put(variant, blobStore.storeThumbnail(imageId, variant, thumbnails.bytes(variant)));
            } catch (RuntimeException e) {
                throw new StageFailureException(PipelineStage.STORE_THUMBNAILS,
                        "cannot store " + variant.variantName() + " thumbnail: "
                                + StageFailureException.reasonOf(e), e);
            }
        }
    }

    private ItemCompletion failed(StopWatch stopWatch, String error) {
        if (stopWatch.isRunning()) {
            stopWatch.stop();
        }
        return ItemCompletion.failed(error, clock.instant(), stopWatch.getTotalTimeMillis());
    }

    private void discard(String imageId, Map<ThumbnailVariant, String> stored) {
        stored.forEach((variant, ref) -> {
            try {
                blobStore.delete(ref);
            } catch (RuntimeException e) {
                log.warn("Could not remove {} thumbnail of image {}: {}", variant.variantName(), imageId, e.getMessage());
            }
        });
        stored.clear();
    }

    private static Map<String, String> toRefs(Map<ThumbnailVariant, String> stored) {
        Map<String, String> refs = new LinkedHashMap<>();
        stored.forEach((variant, ref) -> refs.put(variant.variantName(), ref));
        return refs;
    }
}
