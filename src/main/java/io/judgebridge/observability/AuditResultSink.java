package io.judgebridge.observability;

import io.judgebridge.model.ResultEvent;
import io.judgebridge.session.ResultSink;
import io.judgebridge.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

public final class AuditResultSink implements ResultSink {
    private final AuditLogger audit;

    public AuditResultSink(AuditLogger audit) {
        this.audit = audit;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void notifyResult(String judge, String submissionId, ResultEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("terminal", event.terminal());
        details.put("emitted_at_ms", event.emittedAtMs());
        if (event.payload().isObject()) {
            details.put("payload", Jsons.mapper().convertValue(event.payload(), Map.class));
        }
        audit.log(AuditLogger.AuditEvent.of(
                "submission." + event.type().wireName(),
                judge,
                null,
                submissionId,
                event.terminal() ? "done" : "progress",
                details
        ));
    }
}
