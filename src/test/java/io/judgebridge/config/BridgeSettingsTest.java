package io.judgebridge.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

final class BridgeSettingsTest {

    @Test
    void missingFileMeansDefaults() {
        BridgeSettings settings = BridgeSettings.load(Path.of("does-not-exist", "judgebridge-settings.json"));
        Assertions.assertEquals(BridgeSettings.defaults(), settings);
        Assertions.assertEquals(15_000L, settings.handshakeTimeoutMs());
        Assertions.assertEquals(60_000L, settings.sessionTimeoutMs());
        Assertions.assertEquals(6, settings.healthWindowSize());
        Assertions.assertEquals(5, settings.updateRateLimit());
        Assertions.assertEquals(500L, settings.updateRateWindowMs());
        Assertions.assertEquals(100, settings.maxFeedbackLength());
    }

    @Test
    void fileOverridesAndOutOfRangeValuesFallBack() throws Exception {
        Path root = Files.createTempDirectory("judgebridge-settings-test-");
        try {
            JudgeBridgeConfig config = new JudgeBridgeConfig(root);
            Files.writeString(config.settingsFile(), """
                    {
                      "ackTimeoutMs": 5000,
                      "updateRateLimit": 0,
                      "healthWindowSize": 10,
                      "maxFeedbackLength": -3,
                      "somethingElse": true
                    }
                    """, StandardCharsets.UTF_8);
            BridgeSettings settings = BridgeSettings.load(config.settingsFile());
            Assertions.assertEquals(5_000L, settings.ackTimeoutMs());
            Assertions.assertEquals(10, settings.healthWindowSize());
            Assertions.assertEquals(JudgeBridgeConfig.DEFAULT_UPDATE_RATE_LIMIT, settings.updateRateLimit());
            Assertions.assertEquals(JudgeBridgeConfig.DEFAULT_MAX_FEEDBACK_LENGTH, settings.maxFeedbackLength());
            Assertions.assertEquals(JudgeBridgeConfig.DEFAULT_PING_INTERVAL_MS, settings.pingIntervalMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileIsReported() throws Exception {
        Path root = Files.createTempDirectory("judgebridge-settings-test-");
        try {
            Path file = root.resolve("judgebridge-settings.json");
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(UncheckedIOException.class, () -> BridgeSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void configLaysOutDataRoot() {
        JudgeBridgeConfig config = JudgeBridgeConfig.fromRoot("  ");
        Assertions.assertTrue(config.rootDir().isAbsolute());
        Assertions.assertEquals("data", config.rootDir().getFileName().toString());
        Assertions.assertEquals(config.rootDir().resolve("audit").resolve("audit.log"), config.auditFile());
        Assertions.assertEquals(config.rootDir().resolve("metrics").resolve("judges.prom"), config.metricsFile());
        Assertions.assertEquals(config.rootDir().resolve("judgebridge.db"), config.dbFile());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ignored) {
                }
            });
        }
    }
}
