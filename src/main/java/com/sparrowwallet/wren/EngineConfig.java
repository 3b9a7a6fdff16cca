package com.sparrowwallet.wren;

import java.time.Duration;

/**
 * Tunables for {@link ProtocolEngine}.
 *
 * @param preKeyBatchSize number of one-time pre-keys generated when the pool is refilled
 * @param preKeyLowWaterMark the pool is refilled when it holds fewer keys than this
 * @param skippedKeyMaxAge skipped message keys older than this are discarded
 */
public record EngineConfig(int preKeyBatchSize, int preKeyLowWaterMark, Duration skippedKeyMaxAge) {
    public static final int DEFAULT_PRE_KEY_BATCH_SIZE = 100;
    public static final int DEFAULT_PRE_KEY_LOW_WATER_MARK = 10;
    public static final Duration DEFAULT_SKIPPED_KEY_MAX_AGE = Duration.ofDays(7);

    public static final EngineConfig DEFAULT = new EngineConfig(DEFAULT_PRE_KEY_BATCH_SIZE, DEFAULT_PRE_KEY_LOW_WATER_MARK, DEFAULT_SKIPPED_KEY_MAX_AGE);

    public EngineConfig {
        if(preKeyBatchSize <= 0) {
            throw new IllegalArgumentException("Pre-key batch size must be positive");
        }
        if(preKeyLowWaterMark < 0) {
            throw new IllegalArgumentException("Pre-key low-water mark cannot be negative");
        }
        if(skippedKeyMaxAge == null || skippedKeyMaxAge.isNegative() || skippedKeyMaxAge.isZero()) {
            throw new IllegalArgumentException("Skipped key max age must be positive");
        }
    }

    public EngineConfig withSkippedKeyMaxAge(Duration maxAge) {
        return new EngineConfig(preKeyBatchSize, preKeyLowWaterMark, maxAge);
    }
}
