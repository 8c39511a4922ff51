package com.image.ai.pipeline.controller;

import com.image.ai.pipeline.service.ImageIngestionService;
import com.image.ai.pipeline.service.ImageQueryService;
import com.image.ai.shared.model.ImageCreateResponse;
import com.image.ai.shared.model.ImageEnvelope;
import com.image.ai.shared.model.StatsResponse;
import com.image.ai.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.io.IOException;
import java.util.List;

@RestController
@RequiredArgsConstructor
public class ImageController {

    private final ImageIngestionService ingestionService;
    private final ImageQueryService queryService;

    /**
     * Stores the upload and returns right away; processing continues in the
     * background. Poll {@code GET /api/images/{id}} for the outcome.
     */
    @PostMapping(AppConstants.API_IMAGES)
    public ResponseEntity<ImageCreateResponse> upload(@RequestParam("file") MultipartFile file) throws IOException {
        ImageCreateResponse response = ingestionService.accept(
                file.getOriginalFilename(), file.getContentType(), file.getBytes());
        return ResponseEntity.ok(response);
    }

    @GetMapping(AppConstants.API_IMAGES)
    public ResponseEntity<List<ImageEnvelope>> listImages() {
        return ResponseEntity.ok(queryService.listImages(baseUrl()));
    }

    @GetMapping(AppConstants.API_IMAGES + "/{imageId}")
    public ResponseEntity<ImageEnvelope> getImage(@PathVariable String imageId) {
        return ResponseEntity.ok(queryService.getImage(imageId, baseUrl()));
    }

    @GetMapping(AppConstants.API_IMAGES + "/{imageId}/thumbnails/{size}")
    public ResponseEntity<Resource> getThumbnail(@PathVariable String imageId, @PathVariable String size) {
        Resource thumbnail = queryService.getThumbnail(imageId, size);
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_JPEG)
                .body(thumbnail);
    }

    @GetMapping(AppConstants.API_STATS)
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(queryService.getStats());
    }

    private static String baseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
    }
}
