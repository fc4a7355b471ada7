package io.judgebridge.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class JudgeBridgeConfig {
    public static final String DEFAULT_BIND_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 9999;
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 15_000L;
    public static final long DEFAULT_SESSION_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_ACK_TIMEOUT_MS = 20_000L;
    public static final long DEFAULT_PING_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_HEALTH_WINDOW_SIZE = 6;
    public static final int DEFAULT_UPDATE_RATE_LIMIT = 5;
    public static final long DEFAULT_UPDATE_RATE_WINDOW_MS = 500L;
    public static final int DEFAULT_MAX_FEEDBACK_LENGTH = 100;
    public static final long DEFAULT_STORE_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_MAX_PROBLEM_LIST_SIZE = 100_000;
    public static final int DEFAULT_RESULT_QUEUE_CAPACITY = 1_024;

    private final Path rootDir;

    public JudgeBridgeConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static JudgeBridgeConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new JudgeBridgeConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("judgebridge.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("judgebridge-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path metricsRoot() {
        return rootDir.resolve("metrics");
    }

    public Path metricsFile() {
        return metricsRoot().resolve("judges.prom");
    }
}
