package dev.dataprep.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables for one engine instance.
 */
public record EngineConfig(
    int previewRowLimit,
    long encodingByteBudget,
    int encodingMinConfidence,  // 0..100; weaker detector guesses fall back to UTF-8
    int detectionChunkBytes,
    int conversionChunkChars,
    Path stagingDir,          // null: resolved from the environment or java.io.tmpdir
    Duration stagingMaxAge,
    int maxConcurrentJobs,
    int jobQueueCapacity,
    int maxRecipeDepth
) {
    public static final int DEFAULT_PREVIEW_ROW_LIMIT = 1_000;
    public static final long DEFAULT_ENCODING_BYTE_BUDGET = 200_000;
    public static final int DEFAULT_ENCODING_MIN_CONFIDENCE = 60;
    public static final int DEFAULT_DETECTION_CHUNK_BYTES = 16 * 1024;
    public static final int DEFAULT_CONVERSION_CHUNK_CHARS = 4 * 1024 * 1024;
    public static final Duration DEFAULT_STAGING_MAX_AGE = Duration.ofHours(24);
    public static final int DEFAULT_MAX_CONCURRENT_JOBS = 4;
    public static final int DEFAULT_JOB_QUEUE_CAPACITY = 16;
    public static final int DEFAULT_MAX_RECIPE_DEPTH = 16;

    public EngineConfig {
        if (previewRowLimit <= 0) {
            throw new IllegalArgumentException("previewRowLimit must be positive");
        }
        if (encodingByteBudget <= 0) {
            throw new IllegalArgumentException("encodingByteBudget must be positive");
        }
        if (encodingMinConfidence < 0 || encodingMinConfidence > 100) {
            throw new IllegalArgumentException("encodingMinConfidence must be between 0 and 100");
        }
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("maxConcurrentJobs must be positive");
        }
        if (jobQueueCapacity < 0) {
            throw new IllegalArgumentException("jobQueueCapacity must not be negative");
        }
        if (maxRecipeDepth <= 0) {
            throw new IllegalArgumentException("maxRecipeDepth must be positive");
        }
        if (detectionChunkBytes <= 0 || conversionChunkChars <= 0) {
            throw new IllegalArgumentException("chunk sizes must be positive");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
            DEFAULT_PREVIEW_ROW_LIMIT,
            DEFAULT_ENCODING_BYTE_BUDGET,
            DEFAULT_ENCODING_MIN_CONFIDENCE,
            DEFAULT_DETECTION_CHUNK_BYTES,
            DEFAULT_CONVERSION_CHUNK_CHARS,
            null,
            DEFAULT_STAGING_MAX_AGE,
            DEFAULT_MAX_CONCURRENT_JOBS,
            DEFAULT_JOB_QUEUE_CAPACITY,
            DEFAULT_MAX_RECIPE_DEPTH);
    }

    public EngineConfig withStagingDir(Path dir) {
        return new EngineConfig(previewRowLimit, encodingByteBudget, encodingMinConfidence, detectionChunkBytes,
            conversionChunkChars, dir, stagingMaxAge, maxConcurrentJobs, jobQueueCapacity, maxRecipeDepth);
    }

    public EngineConfig withJobLimits(int maxJobs, int queueCapacity) {
        return new EngineConfig(previewRowLimit, encodingByteBudget, encodingMinConfidence, detectionChunkBytes,
            conversionChunkChars, stagingDir, stagingMaxAge, maxJobs, queueCapacity, maxRecipeDepth);
    }

    public EngineConfig withPreviewRowLimit(int limit) {
        return new EngineConfig(limit, encodingByteBudget, encodingMinConfidence, detectionChunkBytes,
            conversionChunkChars, stagingDir, stagingMaxAge, maxConcurrentJobs, jobQueueCapacity, maxRecipeDepth);
    }

    public EngineConfig withEncodingDetection(long byteBudget, int minConfidence) {
        return new EngineConfig(previewRowLimit, byteBudget, minConfidence, detectionChunkBytes,
            conversionChunkChars, stagingDir, stagingMaxAge, maxConcurrentJobs, jobQueueCapacity, maxRecipeDepth);
    }
}
