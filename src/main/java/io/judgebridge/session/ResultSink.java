package io.judgebridge.session;

import io.judgebridge.model.ResultEvent;

@FunctionalInterface
public interface ResultSink {
    void notifyResult(String judge, String submissionId, ResultEvent event);
}
