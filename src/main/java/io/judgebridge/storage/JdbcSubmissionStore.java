package io.judgebridge.storage;

import io.judgebridge.model.SubmissionDispatchRequest;
import io.judgebridge.session.SubmissionStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;

public final class JdbcSubmissionStore implements SubmissionStore {
    private final Database database;

    public JdbcSubmissionStore(Database database) {
        this.database = database;
    }

    @Override
    public Optional<SubmissionDispatchRequest> fetch(String submissionId) {
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT time_limit, memory_limit, short_circuit, pretests_only, contest_no, attempt_no, user_id
                     FROM submissions WHERE submission_id = ?
                     """)) {
            ps.setString(1, submissionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long contest = rs.getLong("contest_no");
                Long contestId = rs.wasNull() ? null : contest;
                int attempt = rs.getInt("attempt_no");
                Integer attemptNo = rs.wasNull() ? null : attempt;
                return Optional.of(new SubmissionDispatchRequest(
                        rs.getDouble("time_limit"),
                        rs.getLong("memory_limit"),
                        rs.getInt("short_circuit") != 0,
                        rs.getInt("pretests_only") != 0,
                        contestId,
                        attemptNo,
                        rs.getString("user_id")
                ));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load submission " + submissionId, e);
        }
    }

    public void put(String submissionId, SubmissionDispatchRequest data) {
        if (submissionId == null || submissionId.isBlank()) {
            throw new IllegalArgumentException("submission id cannot be empty");
        }
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT OR REPLACE INTO submissions(
                         submission_id, time_limit, memory_limit, short_circuit, pretests_only,
                         contest_no, attempt_no, user_id, created_at_ms)
                     VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                     """)) {
            ps.setString(1, submissionId);
            ps.setDouble(2, data.timeLimitSeconds());
            ps.setLong(3, data.memoryLimitKb());
            ps.setInt(4, data.shortCircuit() ? 1 : 0);
            ps.setInt(5, data.pretestsOnly() ? 1 : 0);
            if (data.contestId() == null) {
                ps.setNull(6, Types.INTEGER);
            } else {
                ps.setLong(6, data.contestId());
            }
            if (data.attemptNo() == null) {
                ps.setNull(7, Types.INTEGER);
            } else {
                ps.setInt(7, data.attemptNo());
            }
            ps.setString(8, data.userId());
            ps.setLong(9, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to store submission " + submissionId, e);
        }
    }
}
