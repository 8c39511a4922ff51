package com.image.ai.pipeline.service;

import com.image.ai.shared.util.constants.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Hands accepted images to the pipeline executor. {@link #submit} returns to
 * the caller at once; the run happens on an {@code image-pipeline-} thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageJobDispatcher {

    private final ImagePipelineCoordinator coordinator;

    @Async(AppConstants.PIPELINE_EXECUTOR)
    public void submit(String imageId) {
        log.debug("Background pipeline run started for image {}", imageId);
        try {
            coordinator.run(imageId);
        } catch (RuntimeException e) {
            // no automatic retry; the row stays PROCESSING and this log line is the only trace
            log.error("Pipeline run for image {} aborted before its terminal write; image left in PROCESSING",
                    imageId, e);
        }
    }
}
