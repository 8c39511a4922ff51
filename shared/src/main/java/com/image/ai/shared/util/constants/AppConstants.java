package com.image.ai.shared.util.constants;

import java.util.Set;

public final class AppConstants {
    private AppConstants() {
    }

    // ── Upload allow-list ──
    public static final String CONTENT_TYPE_JPEG = "image/jpeg";
    public static final String CONTENT_TYPE_PNG = "image/png";
    public static final Set<String> ALLOWED_CONTENT_TYPES = Set.of(CONTENT_TYPE_JPEG, CONTENT_TYPE_PNG);

    // ── Wire status tokens ──
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    // ── SpEL Bindings for @Document ──
    public static final String SPEL_COLLECTION_IMAGES = "#{@environment.getProperty('app.mongodb.collections.images', 'images')}";

    // ── Property placeholders ──
    public static final String PROP_STORE_TYPE = "app.store.type";
    public static final String STORE_TYPE_MONGO = "mongo";
    public static final String STORE_TYPE_MEMORY = "memory";
    public static final String PROP_STORAGE_ROOT = "${app.storage.root:data}";
    public static final String PROP_CAPTION_PROMPT = "${app.caption.prompt:" + AppConstants.DEFAULT_CAPTION_PROMPT + "}";
    public static final String PROP_CAPTION_MAX_CONCURRENCY = "${app.caption.max-concurrency:1}";
    public static final String PROP_CAPTION_MAX_TOKENS = "${app.caption.max-tokens:40}";
    public static final String PROP_EXECUTOR_POOL_SIZE = "${app.pipeline.executor.pool-size:2}";

    // ── Defaults ──
    public static final String DEFAULT_CAPTION_PROMPT = "Describe only what is visually present in this image.";
    public static final String DEFAULT_CAPTION_FALLBACK = "No caption generated.";

    // ── Executor ──
    public static final String PIPELINE_EXECUTOR = "imagePipelineExecutor";
    public static final String PIPELINE_THREAD_PREFIX = "image-pipeline-";

    // ── Routes ──
    public static final String API_IMAGES = "/api/images";
    public static final String API_STATS = "/api/stats";
}
