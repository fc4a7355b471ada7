package io.judgebridge.model;

public enum SubmissionState {
    IDLE,
    REQUESTED,
    ACKNOWLEDGED,
    GRADING
}
