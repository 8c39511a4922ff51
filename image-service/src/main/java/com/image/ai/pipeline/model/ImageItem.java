package com.image.ai.pipeline.model;

import com.image.ai.shared.util.constants.AppConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One uploaded image and its processing lifecycle.
 * <p>
 * Success-only fields ({@code width}, {@code height}, {@code format},
 * {@code caption}, {@code thumbnailRefs}) are set iff {@code status} is
 * {@link ImageStatus#SUCCEEDED}; {@code error} iff {@link ImageStatus#FAILED};
 * {@code completedAt} and {@code processingDurationMs} iff terminal.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = AppConstants.SPEL_COLLECTION_IMAGES)
public class ImageItem {

    @Id
    private String id;

    private String originalName;
    private String mimeType;
    private long sizeBytes;
    private String storedRef;

    @Indexed
    private ImageStatus status;

    private Integer width;
    private Integer height;
    private String format;
    private String caption;
    private String error;
    private Map<String, String> thumbnailRefs;

    @Indexed
    private Instant createdAt;
    private Instant completedAt;
    private Long processingDurationMs;

    public static ImageItem accepted(String id, String originalName, String mimeType,
                                     long sizeBytes, String storedRef, Instant createdAt) {
        return ImageItem.builder()
                .id(id)
                .originalName(originalName)
                .mimeType(mimeType)
                .sizeBytes(sizeBytes)
                .storedRef(storedRef)
                .status(ImageStatus.PROCESSING)
                .createdAt(createdAt)
                .build();
    }

    public String thumbnailRef(ThumbnailVariant variant) {
        return thumbnailRefs == null ? null : thumbnailRefs.get(variant.variantName());
    }
}
