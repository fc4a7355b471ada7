package io.judgebridge.storage;

import io.judgebridge.session.JudgeAuthenticator;
import io.judgebridge.util.Hashing;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public final class JdbcJudgeAuthenticator implements JudgeAuthenticator {
    private final Database database;

    public JdbcJudgeAuthenticator(Database database) {
        this.database = database;
    }

    @Override
    public boolean authenticate(String judgeId, String key) {
        if (judgeId == null || judgeId.isBlank() || key == null) {
            return false;
        }
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT key_sha256, blocked FROM judges WHERE name = ?")) {
            ps.setString(1, judgeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                if (rs.getInt("blocked") != 0) {
                    return false;
                }
                return Hashing.matchesSha256Hex(key, rs.getString("key_sha256"));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to look up judge " + judgeId, e);
        }
    }

    public void upsert(String judgeId, String key, boolean blocked) {
        if (judgeId == null || judgeId.isBlank()) {
            throw new IllegalArgumentException("judge id cannot be empty");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("judge key cannot be empty");
        }
        long now = Instant.now().toEpochMilli();
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO judges(name, key_sha256, blocked, created_at_ms, updated_at_ms)
                     VALUES (?, ?, ?, ?, ?)
                     ON CONFLICT(name) DO UPDATE SET
                         key_sha256 = excluded.key_sha256,
                         blocked = excluded.blocked,
                         updated_at_ms = excluded.updated_at_ms
                     """)) {
            ps.setString(1, judgeId.trim());
            ps.setString(2, Hashing.sha256Hex(key));
            ps.setInt(3, blocked ? 1 : 0);
            ps.setLong(4, now);
            ps.setLong(5, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to store judge " + judgeId, e);
        }
    }
}
