package io.judgebridge.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.judgebridge.model.SubmissionDispatchRequest;
import io.judgebridge.util.Jsons;

public final class OutboundMessages {
    private OutboundMessages() {
    }

    public static String handshakeSuccess() {
        return named("handshake-success");
    }

    public static String terminateSubmission() {
        return named("terminate-submission");
    }

    public static String disconnect() {
        return named("disconnect");
    }

    public static String ping(double whenSeconds) {
        ObjectNode out = Jsons.object();
        out.put("name", "ping");
        out.put("when", whenSeconds);
        return Jsons.toCompactJson(out);
    }

    public static String submissionRequest(
            String submissionId,
            String problemId,
            String language,
            String source,
            SubmissionDispatchRequest data
    ) {
        ObjectNode out = Jsons.object();
        out.put("name", "submission-request");
        out.put("submission-id", submissionId);
        out.put("problem-id", problemId);
        out.put("language", language);
        out.put("source", source);
        out.put("time-limit", data.timeLimitSeconds());
        out.put("memory-limit", data.memoryLimitKb());
        out.put("short-circuit", data.shortCircuit());
        ObjectNode meta = out.putObject("meta");
        meta.put("pretests-only", data.pretestsOnly());
        if (data.contestId() == null) {
            meta.putNull("in-contest");
        } else {
            meta.put("in-contest", data.contestId());
        }
        if (data.attemptNo() == null) {
            meta.putNull("attempt-no");
        } else {
            meta.put("attempt-no", data.attemptNo());
        }
        meta.put("user", data.userId());
        return Jsons.toCompactJson(out);
    }

    private static String named(String name) {
        ObjectNode out = Jsons.object();
        out.put("name", name);
        return Jsons.toCompactJson(out);
    }
}
