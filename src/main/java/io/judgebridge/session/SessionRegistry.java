package io.judgebridge.session;

public interface SessionRegistry {
    void register(JudgeSession session);

    // Called after all of the session's background tasks are cancelled.
    void unregister(JudgeSession session);

    default void sessionUpdated(JudgeSession session) {
    }
}
