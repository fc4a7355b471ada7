package io.judgebridge.storage;

import io.judgebridge.config.JudgeBridgeConfig;
import io.judgebridge.model.SubmissionDispatchRequest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

final class JdbcStorageTest {

    @Test
    void judgeCredentialsAreHashedAndCheckedInConstantTime() throws Exception {
        Path root = Files.createTempDirectory("judgebridge-storage-test-");
        try {
            Database database = new Database(new JudgeBridgeConfig(root));
            database.init();
            JdbcJudgeAuthenticator authenticator = new JdbcJudgeAuthenticator(database);
            authenticator.upsert("j1", "correct horse", false);

            Assertions.assertTrue(authenticator.authenticate("j1", "correct horse"));
            Assertions.assertFalse(authenticator.authenticate("j1", "wrong"));
            Assertions.assertFalse(authenticator.authenticate("ghost", "correct horse"));
            Assertions.assertFalse(authenticator.authenticate(null, "correct horse"));

            try (Connection conn = database.openConnection();
                 Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT key_sha256 FROM judges WHERE name = 'j1'")) {
                Assertions.assertTrue(rs.next());
                Assertions.assertEquals(64, rs.getString(1).length());
                Assertions.assertNotEquals("correct horse", rs.getString(1));
            }

            authenticator.upsert("j1", "correct horse", true);
            Assertions.assertFalse(authenticator.authenticate("j1", "correct horse"));
            authenticator.upsert("j1", "battery staple", false);
            Assertions.assertTrue(authenticator.authenticate("j1", "battery staple"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> authenticator.upsert(" ", "k", false));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void submissionMetadataRoundTripsIncludingNulls() throws Exception {
        Path root = Files.createTempDirectory("judgebridge-storage-test-");
        try {
            Database database = new Database(new JudgeBridgeConfig(root));
            database.init();
            database.init();
            JdbcSubmissionStore store = new JdbcSubmissionStore(database);
            store.put("1", new SubmissionDispatchRequest(2.5, 262_144L, true, false, 9L, 4, "dave"));
            store.put("2", new SubmissionDispatchRequest(1.0, 1_024L, false, true, null, null, null));

            Assertions.assertEquals(
                    Optional.of(new SubmissionDispatchRequest(2.5, 262_144L, true, false, 9L, 4, "dave")),
                    store.fetch("1")
            );
            SubmissionDispatchRequest second = store.fetch("2").orElseThrow();
            Assertions.assertNull(second.contestId());
            Assertions.assertNull(second.attemptNo());
            Assertions.assertNull(second.userId());
            Assertions.assertTrue(second.pretestsOnly());
            Assertions.assertTrue(store.fetch("3").isEmpty());
        } finally {
            deleteRecursively(root);
        }
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
