package com.image.ai.pipeline.service;

import com.image.ai.pipeline.derivation.StageFailureException;
import com.image.ai.pipeline.exception.ImageValidationException;
import com.image.ai.pipeline.exception.PipelineUnavailableException;
import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ItemCompletion;
import com.image.ai.pipeline.repository.ImageItemStore;
import com.image.ai.pipeline.storage.BlobStore;
import com.image.ai.shared.constant.APIMessages;
import com.image.ai.shared.model.ImageCreateResponse;
import com.image.ai.shared.util.ImageIdGenerator;
import com.image.ai.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImageIngestionService {

    private final ImageItemStore itemStore;
    private final BlobStore blobStore;
    private final ImageJobDispatcher dispatcher;
    private final Clock clock;

    /**
     * Accepts an upload: stores the original, inserts the {@code PROCESSING}
     * row and schedules the pipeline. Returns once both writes are durable.
     *
     * @throws ImageValidationException for a disallowed content type or empty body,
     *                                  before any id is generated
     * @throws PipelineUnavailableException when the executor refuses the run
     *                                      (shutdown); the item is recorded as failed
     */
    public ImageCreateResponse accept(String originalName, String contentType, byte[] contents) {
        log.info("Accepting upload: {} ({})", originalName, contentType);

        String mimeType = validate(contentType, contents);

        String imageId = ImageIdGenerator.generate();
        String extension = AppConstants.CONTENT_TYPE_JPEG.equals(mimeType) ? "jpg" : "png";

        String storedRef = blobStore.storeOriginal(imageId, extension, contents);
        try {
            itemStore.insert(ImageItem.accepted(imageId, originalName, mimeType,
                    contents.length, storedRef, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to record image {}, removing stored original", imageId, e);
            deleteQuietly(storedRef, e);
            throw e;
        }

        try {
            dispatcher.submit(imageId);
        } catch (TaskRejectedException e) {
            log.error("Pipeline executor rejected image {}, recording it as failed", imageId, e);
            markUnscheduled(imageId, e);
            throw new PipelineUnavailableException(APIMessages.ERROR_PIPELINE_UNAVAILABLE, e);
        }

        log.info("Image {} accepted ({} bytes)", imageId, contents.length);
        return new ImageCreateResponse(imageId, ImageStatus.PROCESSING.token());
    }

    private static String validate(String contentType, byte[] contents) {
        String mimeType = contentType == null ? "" : contentType.trim().toLowerCase(Locale.ROOT);
        if (!AppConstants.ALLOWED_CONTENT_TYPES.contains(mimeType)) {
            throw new ImageValidationException("UNSUPPORTED_CONTENT_TYPE", APIMessages.ERROR_UNSUPPORTED_TYPE);
        }
        if (contents == null || contents.length == 0) {
            throw new ImageValidationException("EMPTY_UPLOAD", APIMessages.ERROR_EMPTY_UPLOAD);
        }
        return mimeType;
    }

    private void markUnscheduled(String imageId, TaskRejectedException rejection) {
        try {
            itemStore.complete(imageId, ItemCompletion.failed(
                    "scheduling failed: " + StageFailureException.reasonOf(rejection), clock.instant(), 0L));
        } catch (RuntimeException e) {
            rejection.addSuppressed(e);
        }
    }

    private void deleteQuietly(String storedRef, RuntimeException original) {
        try {
            blobStore.delete(storedRef);
        } catch (RuntimeException cleanup) {
            original.addSuppressed(cleanup);
        }
    }
}
