package com.image.ai.pipeline.repository;

import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImageItemRepository extends MongoRepository<ImageItem, String> {

    List<ImageItem> findAllByOrderByCreatedAtDesc();

    long countByStatus(ImageStatus status);
}
