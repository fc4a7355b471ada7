package io.judgebridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public record ResultEvent(
        ResultEventType type,
        String submissionId,
        JsonNode payload,
        long emittedAtMs
) {
    public ResultEvent {
        if (type == null) {
            throw new IllegalArgumentException("result event type is required");
        }
        payload = payload == null ? NullNode.getInstance() : payload;
    }

    public boolean terminal() {
        return type.terminal();
    }
}
