package com.image.ai.pipeline.repository;

import com.image.ai.pipeline.exception.DuplicateImageException;
import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ItemCompletion;
import com.image.ai.shared.constant.APIMessages;
import com.image.ai.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local store. Rows are held as private snapshots and replaced as a
 * whole, so a reader racing {@link #complete} sees one version or the other.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = AppConstants.PROP_STORE_TYPE, havingValue = AppConstants.STORE_TYPE_MEMORY)
public class InMemoryImageItemStore implements ImageItemStore {

    private final Map<String, ImageItem> store = new ConcurrentHashMap<>();

    @Override
    public ImageItem insert(ImageItem item) {
        Objects.requireNonNull(item.getId(), "id");
        ImageItem previous = store.putIfAbsent(item.getId(), snapshot(item));
        if (previous != null) {
            throw new DuplicateImageException(APIMessages.ERROR_DUPLICATE_IMAGE + item.getId(), null);
        }
        return snapshot(item);
    }

    @Override
    public Optional<ImageItem> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(InMemoryImageItemStore::snapshot);
    }

    @Override
    public List<ImageItem> findAllNewestFirst() {
        return store.values().stream()
                .sorted(Comparator.comparing(ImageItem::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .map(InMemoryImageItemStore::snapshot)
                .toList();
    }

    @Override
    public boolean complete(String id, ItemCompletion completion) {
        AtomicBoolean applied = new AtomicBoolean(false);
        store.computeIfPresent(id, (key, current) -> {
            if (current.getStatus() != ImageStatus.PROCESSING) {
                return current;
            }
            applied.set(true);
            return completion.applyTo(current);
        });
        if (!applied.get()) {
            log.warn("Terminal write for image {} matched no PROCESSING row", id);
        }
        return applied.get();
    }

    @Override
    public long count() {
        return store.size();
    }

    @Override
    public long countByStatus(ImageStatus status) {
        return store.values().stream().filter(i -> i.getStatus() == status).count();
    }

    @Override
    public OptionalDouble averageProcessingDurationMs() {
        return store.values().stream()
                .map(ImageItem::getProcessingDurationMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average();
    }

    private static ImageItem snapshot(ImageItem item) {
        ImageItem copy = item.toBuilder().build();
        if (item.getThumbnailRefs() != null) {
            copy.setThumbnailRefs(Map.copyOf(item.getThumbnailRefs()));
        }
        return copy;
    }
}
