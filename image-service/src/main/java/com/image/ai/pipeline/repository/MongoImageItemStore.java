package com.image.ai.pipeline.repository;

import com.image.ai.pipeline.exception.DuplicateImageException;
import com.image.ai.pipeline.exception.ImageStoreException;
import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ItemCompletion;
import com.image.ai.shared.constant.APIMessages;
import com.image.ai.shared.util.constants.AppConstants;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = AppConstants.PROP_STORE_TYPE, havingValue = AppConstants.STORE_TYPE_MONGO, matchIfMissing = true)
public class MongoImageItemStore implements ImageItemStore {

    static final String FIELD_ID = "_id";
    static final String FIELD_STATUS = "status";
    static final String FIELD_DURATION = "processingDurationMs";
    static final String AVERAGE_ALIAS = "averageMs";

    private final ImageItemRepository repository;
    private final MongoTemplate mongoTemplate;

    @Override
    public ImageItem insert(ImageItem item) {
        try {
            return repository.insert(item);
        } catch (DuplicateKeyException e) {
            throw new DuplicateImageException(APIMessages.ERROR_DUPLICATE_IMAGE + item.getId(), e);
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to insert image " + item.getId(), e);
        }
    }

    @Override
    public Optional<ImageItem> findById(String id) {
        try {
            return repository.findById(id);
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to load image " + id, e);
        }
    }

    @Override
    public List<ImageItem> findAllNewestFirst() {
        try {
            return repository.findAllByOrderByCreatedAtDesc();
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to list images", e);
        }
    }

    /**
     * Single-document conditional update: the status filter makes a second
     * terminal write a no-op, and MongoDB applies all fields of one update
     * atomically.
     */
    @Override
    public boolean complete(String id, ItemCompletion completion) {
        Query query = Query.query(Criteria.where(FIELD_ID).is(id)
                .and(FIELD_STATUS).is(ImageStatus.PROCESSING));
        try {
            UpdateResult result = mongoTemplate.updateFirst(query, toUpdate(completion), ImageItem.class);
            boolean applied = result.getModifiedCount() == 1;
            if (!applied) {
                log.warn("Terminal write for image {} matched no PROCESSING row", id);
            }
            return applied;
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to complete image " + id, e);
        }
    }

    @Override
    public long count() {
        try {
            return repository.count();
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to count images", e);
        }
    }

    @Override
    public long countByStatus(ImageStatus status) {
        try {
            return repository.countByStatus(status);
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to count images with status " + status, e);
        }
    }

    @Override
    public OptionalDouble averageProcessingDurationMs() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where(FIELD_DURATION).ne(null)),
                Aggregation.group().avg(FIELD_DURATION).as(AVERAGE_ALIAS));
        try {
            Document result = mongoTemplate.aggregate(aggregation, ImageItem.class, Document.class)
                    .getUniqueMappedResult();
            if (result == null || !(result.get(AVERAGE_ALIAS) instanceof Number average)) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(average.doubleValue());
        } catch (DataAccessException e) {
            throw new ImageStoreException("Failed to aggregate processing durations", e);
        }
    }

    static Update toUpdate(ItemCompletion completion) {
        Update update = new Update()
                .set(FIELD_STATUS, completion.status())
                .set("completedAt", completion.completedAt())
                .set(FIELD_DURATION, completion.processingDurationMs());
        if (completion.status() == ImageStatus.SUCCEEDED) {
            update.set("width", completion.width())
                    .set("height", completion.height())
                    .set("format", completion.format())
                    .set("caption", completion.caption())
                    .set("thumbnailRefs", completion.thumbnailRefs())
                    .unset("error");
        } else {
            update.set("error", completion.error())
                    .unset("width")
                    .unset("height")
                    .unset("format")
                    .unset("caption")
                    .unset("thumbnailRefs");
        }
        return update;
    }
}
