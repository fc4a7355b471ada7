package io.judgebridge.storage;

import io.judgebridge.config.JudgeBridgeConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final JudgeBridgeConfig config;
    private final String jdbcUrl;

    public Database(JudgeBridgeConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.metricsRoot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS judges (
                        name TEXT PRIMARY KEY,
                        key_sha256 TEXT NOT NULL,
                        blocked INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS submissions (
                        submission_id TEXT PRIMARY KEY,
                        time_limit REAL NOT NULL,
                        memory_limit INTEGER NOT NULL,
                        short_circuit INTEGER NOT NULL DEFAULT 0,
                        pretests_only INTEGER NOT NULL DEFAULT 0,
                        contest_no INTEGER,
                        attempt_no INTEGER,
                        user_id TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize schema at " + config.dbFile(), e);
        }
    }
}
