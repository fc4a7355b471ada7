package io.judgebridge.session;

public final class SubmissionDataUnavailableException extends RuntimeException {
    private final String submissionId;

    public SubmissionDataUnavailableException(String submissionId, String reason) {
        super("Submission data unavailable for " + submissionId + ": " + reason);
        this.submissionId = submissionId;
    }

    public SubmissionDataUnavailableException(String submissionId, String reason, Throwable cause) {
        super("Submission data unavailable for " + submissionId + ": " + reason, cause);
        this.submissionId = submissionId;
    }

    public String submissionId() {
        return submissionId;
    }
}
