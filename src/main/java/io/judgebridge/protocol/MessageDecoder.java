package io.judgebridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.judgebridge.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Never throws: anything unexpected yields Unrecognized.
public final class MessageDecoder {
    private static final int MAX_RAW_CHARS = 512;
    private static final int MAX_TEXT_CHARS = 64 * 1024;

    private final int maxProblems;

    public MessageDecoder(int maxProblems) {
        this.maxProblems = Math.max(1, maxProblems);
    }

    public InboundMessage decode(String raw) {
        JsonNode packet;
        try {
            packet = raw == null ? null : Jsons.readTree(raw);
        } catch (Exception e) {
            return unrecognized(null, raw, "invalid json");
        }
        if (packet == null || !packet.isObject()) {
            return unrecognized(null, raw, "not an object");
        }
        JsonNode nameNode = packet.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            return unrecognized(null, raw, "missing name");
        }
        String name = nameNode.asText();
        try {
            return decodeNamed(name, packet, raw);
        } catch (RuntimeException e) {
            return unrecognized(name, raw, "bad fields: " + e.getMessage());
        }
    }

    private InboundMessage decodeNamed(String name, JsonNode packet, String raw) {
        switch (name) {
            case "handshake":
                return new InboundMessage.Handshake(
                        text(packet, "id"),
                        text(packet, "key"),
                        problems(packet.get("problems")),
                        executors(packet.get("executors"))
                );
            case "ping-response": {
                Double when = number(packet, "when");
                Double time = number(packet, "time");
                Double load = number(packet, "load");
                if (when == null || time == null) {
                    return unrecognized(name, raw, "ping-response without when/time");
                }
                return new InboundMessage.PingResponse(when, time, load == null ? Double.MAX_VALUE : load);
            }
            case "supported-problems":
                return new InboundMessage.SupportedProblems(problems(packet.get("problems")));
            default:
                break;
        }

        String submissionId = submissionId(packet);
        if (submissionId == null) {
            if (isLifecycleName(name)) {
                return unrecognized(name, raw, "missing submission-id");
            }
            return unrecognized(name, raw, "unknown name");
        }
        switch (name) {
            case "submission-acknowledged":
                return new InboundMessage.SubmissionAcknowledged(submissionId);
            case "grading-begin":
                return new InboundMessage.GradingBegin(submissionId, packet.path("pretested").asBoolean(false));
            case "grading-end":
                return new InboundMessage.GradingEnd(submissionId);
            case "compile-error":
                return new InboundMessage.CompileError(submissionId, cap(text(packet, "log")));
            case "compile-message":
                return new InboundMessage.CompileMessage(submissionId, cap(text(packet, "log")));
            case "batch-begin": {
                JsonNode batch = packet.get("batch-no");
                Integer batchNo = batch != null && batch.canConvertToInt() ? batch.asInt() : null;
                return new InboundMessage.BatchBegin(submissionId, batchNo);
            }
            case "batch-end":
                return new InboundMessage.BatchEnd(submissionId);
            case "test-case-status":
                return new InboundMessage.TestCaseStatus(submissionId, cases(packet));
            case "internal-error":
                return new InboundMessage.InternalError(submissionId, cap(text(packet, "message")));
            case "submission-terminated":
                return new InboundMessage.SubmissionTerminated(submissionId);
            default:
                return unrecognized(name, raw, "unknown name");
        }
    }

    private static boolean isLifecycleName(String name) {
        switch (name) {
            case "submission-acknowledged":
            case "grading-begin":
            case "grading-end":
            case "compile-error":
            case "compile-message":
            case "batch-begin":
            case "batch-end":
            case "test-case-status":
            case "internal-error":
            case "submission-terminated":
                return true;
            default:
                return false;
        }
    }

    // Workers send ids as numbers or strings.
    private static String submissionId(JsonNode packet) {
        JsonNode id = packet.get("submission-id");
        if (id == null || id.isNull() || !(id.isTextual() || id.isIntegralNumber())) {
            return null;
        }
        String value = id.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static String text(JsonNode packet, String field) {
        JsonNode node = packet.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static Double number(JsonNode packet, String field) {
        JsonNode node = packet.get(field);
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        return Double.isFinite(value) ? value : null;
    }

    // Problems arrive either as ids or as [id, mtime] pairs.
    private List<String> problems(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode item : node) {
            if (out.size() >= maxProblems) {
                break;
            }
            JsonNode idNode = item.isArray() && item.size() > 0 ? item.get(0) : item;
            if (idNode != null && idNode.isTextual() && !idNode.asText().isBlank()) {
                out.add(idNode.asText().trim());
            }
        }
        return List.copyOf(out);
    }

    private static Map<String, JsonNode> executors(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getKey().isBlank()) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static List<JsonNode> cases(JsonNode packet) {
        JsonNode cases = packet.get("cases");
        List<JsonNode> out = new ArrayList<>();
        if (cases != null && cases.isArray()) {
            for (JsonNode item : cases) {
                if (item.isObject()) {
                    out.add(item);
                }
            }
            return out;
        }
        out.add(packet);
        return out;
    }

    private static String cap(String value) {
        if (value == null || value.length() <= MAX_TEXT_CHARS) {
            return value;
        }
        return value.substring(0, MAX_TEXT_CHARS);
    }

    private static InboundMessage.Unrecognized unrecognized(String name, String raw, String reason) {
        return new InboundMessage.Unrecognized(name, truncate(raw), reason);
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_RAW_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_RAW_CHARS) + "...";
    }
}
