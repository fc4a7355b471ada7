package io.judgebridge.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.judgebridge.security.SensitiveDataMasker;
import io.judgebridge.util.Hashing;
import io.judgebridge.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("judge", event.judge());
        row.put("address", event.address());
        row.put("submission", event.submission());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    // Returns the number of rows verified, or -(line) of the first bad row.
    public synchronized long verify() {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            String expectedPrev = "";
            long rows = 0;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                JsonNode node = Jsons.readTree(line);
                String hash = node.path("hash").asText("");
                Map<String, Object> unhashed = new LinkedHashMap<>();
                node.fields().forEachRemaining(e -> {
                    if (!"hash".equals(e.getKey())) {
                        unhashed.put(e.getKey(), e.getValue());
                    }
                });
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))
                        || !hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unhashed)))) {
                    return -(i + 1L);
                }
                expectedPrev = hash;
                rows++;
            }
            return rows;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.readTree(last).path("hash").asText("");
        } catch (Exception ignored) {
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String judge,
            String address,
            String submission,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String judge,
                String address,
                String submission,
                String result,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, judge, address, submission, result, details == null ? Map.of() : details);
        }
    }
}
