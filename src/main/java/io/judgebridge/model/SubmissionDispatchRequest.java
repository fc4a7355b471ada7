package io.judgebridge.model;

// Grading parameters sent with a submission-request. Limits are per case, memory in kilobytes.
public record SubmissionDispatchRequest(
        double timeLimitSeconds,
        long memoryLimitKb,
        boolean shortCircuit,
        boolean pretestsOnly,
        Long contestId,
        Integer attemptNo,
        String userId
) {
}
