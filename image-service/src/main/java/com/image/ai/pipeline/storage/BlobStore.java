package com.image.ai.pipeline.storage;

import com.image.ai.pipeline.model.ThumbnailVariant;
import org.springframework.core.io.Resource;

import java.util.Optional;

/**
 * Durable byte storage for originals and derived thumbnails, addressed by
 * item id plus variant. References returned here are opaque to callers.
 */
public interface BlobStore {

    String storeOriginal(String itemId, String extension, byte[] bytes);

    /** Thumbnails are always JPEG, whatever the source encoding. */
    String storeThumbnail(String itemId, ThumbnailVariant variant, byte[] bytes);

    byte[] read(String ref);

    Optional<Resource> open(String ref);

    long size(String ref);

    void delete(String ref);
}
