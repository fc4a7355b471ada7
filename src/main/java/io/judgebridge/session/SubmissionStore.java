package io.judgebridge.session;

import io.judgebridge.model.SubmissionDispatchRequest;

import java.util.Optional;

@FunctionalInterface
public interface SubmissionStore {
    Optional<SubmissionDispatchRequest> fetch(String submissionId);
}
