package com.image.ai.pipeline.repository;

import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ItemCompletion;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Durable record store for image lifecycle rows.
 * <p>
 * Each row has two writes over its lifetime: {@link #insert} by the acceptance
 * path and {@link #complete} by the pipeline. Readers see either the state
 * before or after the terminal write, never a mix of both.
 */
public interface ImageItemStore {

    /**
     * Inserts a new {@code PROCESSING} row.
     *
     * @throws com.image.ai.pipeline.exception.DuplicateImageException if the id is taken
     * @throws com.image.ai.pipeline.exception.ImageStoreException     on storage faults
     */
    ImageItem insert(ImageItem item);

    Optional<ImageItem> findById(String id);

    /** All rows ordered by {@code createdAt}, newest first. */
    List<ImageItem> findAllNewestFirst();

    /**
     * Atomically moves a {@code PROCESSING} row to the completion's terminal
     * status.
     *
     * @return {@code false} if the row is missing or already terminal; nothing
     * is written in that case
     */
    boolean complete(String id, ItemCompletion completion);

    long count();

    long countByStatus(ImageStatus status);

    /** Mean of {@code processingDurationMs} over rows that have one. */
    OptionalDouble averageProcessingDurationMs();
}
