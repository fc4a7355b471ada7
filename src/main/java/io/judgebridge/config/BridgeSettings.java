package io.judgebridge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.judgebridge.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

// Missing or out-of-range fields fall back to JudgeBridgeConfig defaults.
public record BridgeSettings(
        long handshakeTimeoutMs,
        long sessionTimeoutMs,
        long ackTimeoutMs,
        long pingIntervalMs,
        int healthWindowSize,
        int updateRateLimit,
        long updateRateWindowMs,
        int maxFeedbackLength,
        long storeTimeoutMs,
        int maxProblemListSize,
        int resultQueueCapacity
) {
    public static BridgeSettings defaults() {
        return new BridgeSettings(
                JudgeBridgeConfig.DEFAULT_HANDSHAKE_TIMEOUT_MS,
                JudgeBridgeConfig.DEFAULT_SESSION_TIMEOUT_MS,
                JudgeBridgeConfig.DEFAULT_ACK_TIMEOUT_MS,
                JudgeBridgeConfig.DEFAULT_PING_INTERVAL_MS,
                JudgeBridgeConfig.DEFAULT_HEALTH_WINDOW_SIZE,
                JudgeBridgeConfig.DEFAULT_UPDATE_RATE_LIMIT,
                JudgeBridgeConfig.DEFAULT_UPDATE_RATE_WINDOW_MS,
                JudgeBridgeConfig.DEFAULT_MAX_FEEDBACK_LENGTH,
                JudgeBridgeConfig.DEFAULT_STORE_TIMEOUT_MS,
                JudgeBridgeConfig.DEFAULT_MAX_PROBLEM_LIST_SIZE,
                JudgeBridgeConfig.DEFAULT_RESULT_QUEUE_CAPACITY
        );
    }

    public static BridgeSettings load(Path file) {
        BridgeSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings: " + file, e);
        }
    }

    static BridgeSettings fromFile(SettingsFile file, BridgeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new BridgeSettings(
                sanitizeLong(file.handshakeTimeoutMs(), defaults.handshakeTimeoutMs(), 100L),
                sanitizeLong(file.sessionTimeoutMs(), defaults.sessionTimeoutMs(), 100L),
                sanitizeLong(file.ackTimeoutMs(), defaults.ackTimeoutMs(), 10L),
                sanitizeLong(file.pingIntervalMs(), defaults.pingIntervalMs(), 10L),
                sanitizeInt(file.healthWindowSize(), defaults.healthWindowSize(), 1),
                sanitizeInt(file.updateRateLimit(), defaults.updateRateLimit(), 1),
                sanitizeLong(file.updateRateWindowMs(), defaults.updateRateWindowMs(), 1L),
                sanitizeInt(file.maxFeedbackLength(), defaults.maxFeedbackLength(), 0),
                sanitizeLong(file.storeTimeoutMs(), defaults.storeTimeoutMs(), 10L),
                sanitizeInt(file.maxProblemListSize(), defaults.maxProblemListSize(), 1),
                sanitizeInt(file.resultQueueCapacity(), defaults.resultQueueCapacity(), 1)
        );
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long handshakeTimeoutMs,
            Long sessionTimeoutMs,
            Long ackTimeoutMs,
            Long pingIntervalMs,
            Integer healthWindowSize,
            Integer updateRateLimit,
            Long updateRateWindowMs,
            Integer maxFeedbackLength,
            Long storeTimeoutMs,
            Integer maxProblemListSize,
            Integer resultQueueCapacity
    ) {
    }
}
