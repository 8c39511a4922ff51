package com.image.ai.pipeline.service;

import com.image.ai.pipeline.exception.ImageNotFoundException;
import com.image.ai.pipeline.exception.ImageValidationException;
import com.image.ai.pipeline.exception.ThumbnailNotReadyException;
import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageMetadata;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ThumbnailVariant;
import com.image.ai.pipeline.repository.ImageItemStore;
import com.image.ai.pipeline.storage.BlobStore;
import com.image.ai.shared.constant.APIMessages;
import com.image.ai.shared.model.ImageData;
import com.image.ai.shared.model.ImageEnvelope;
import com.image.ai.shared.model.StatsResponse;
import com.image.ai.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only projections of image rows. Metadata and thumbnail links are only
 * exposed for {@code SUCCEEDED} rows.
 */
@Service
@RequiredArgsConstructor
public class ImageQueryService {

    private final ImageItemStore itemStore;
    private final BlobStore blobStore;

    public List<ImageEnvelope> listImages(String baseUrl) {
        return itemStore.findAllNewestFirst().stream()
                .map(item -> toEnvelope(item, baseUrl))
                .toList();
    }

    public ImageEnvelope getImage(String imageId, String baseUrl) {
        return toEnvelope(load(imageId), baseUrl);
    }

    public Resource getThumbnail(String imageId, String size) {
        ThumbnailVariant variant = ThumbnailVariant.fromName(size)
                .orElseThrow(() -> new ImageValidationException("INVALID_THUMBNAIL_SIZE",
                        APIMessages.ERROR_INVALID_THUMBNAIL_SIZE));

        ImageItem item = load(imageId);
        if (item.getStatus() != ImageStatus.SUCCEEDED) {
            throw new ThumbnailNotReadyException(APIMessages.ERROR_THUMBNAILS_NOT_READY, item.getStatus());
        }
        return blobStore.open(item.thumbnailRef(variant))
                .orElseThrow(() -> new ImageNotFoundException(APIMessages.ERROR_THUMBNAIL_NOT_FOUND));
    }

    public StatsResponse getStats() {
        long total = itemStore.count();
        long failed = itemStore.countByStatus(ImageStatus.FAILED);
        long succeeded = itemStore.countByStatus(ImageStatus.SUCCEEDED);
        double averageMs = itemStore.averageProcessingDurationMs().orElse(0.0);

        double successRate = total == 0 ? 0.0 : succeeded * 100.0 / total;
        return new StatsResponse(
                total,
                failed,
                String.format(Locale.ROOT, "%.2f%%", successRate),
                averageMs / 1000.0);
    }

    private ImageItem load(String imageId) {
        return itemStore.findById(imageId)
                .orElseThrow(() -> new ImageNotFoundException(APIMessages.ERROR_IMAGE_NOT_FOUND));
    }

    ImageEnvelope toEnvelope(ImageItem item, String baseUrl) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Map<String, String> thumbnails = new LinkedHashMap<>();

        if (item.getStatus() == ImageStatus.SUCCEEDED) {
            for (ThumbnailVariant variant : ThumbnailVariant.values()) {
                thumbnails.put(variant.variantName(), baseUrl + AppConstants.API_IMAGES + "/" + item.getId()
                        + "/thumbnails/" + variant.variantName());
            }
            metadata.put("width", item.getWidth());
            metadata.put("height", item.getHeight());
            metadata.put("format", ImageMetadata.clientFormat(item.getFormat()));
            metadata.put("size_bytes", item.getSizeBytes());
            metadata.put("caption", item.getCaption());
        }

        ImageData data = new ImageData(
                item.getId(),
                item.getOriginalName(),
                formatInstant(item.getCompletedAt()),
                metadata,
                thumbnails);
        return new ImageEnvelope(item.getStatus().token(), data, item.getError());
    }

    private static String formatInstant(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
