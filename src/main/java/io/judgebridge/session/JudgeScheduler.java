package io.judgebridge.session;

public interface JudgeScheduler {
    void rescheduleSubmission(String judge, String submissionId);

    void submissionNeedsAttention(String judge, String submissionId, String message);

    static JudgeScheduler noop() {
        return new JudgeScheduler() {
            @Override
            public void rescheduleSubmission(String judge, String submissionId) {
            }

            @Override
            public void submissionNeedsAttention(String judge, String submissionId, String message) {
            }
        };
    }
}
