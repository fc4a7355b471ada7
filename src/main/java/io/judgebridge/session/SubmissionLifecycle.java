package io.judgebridge.session;

import io.judgebridge.model.SubmissionState;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

// IDLE -> REQUESTED -> ACKNOWLEDGED -> GRADING -> IDLE
public final class SubmissionLifecycle {
    private static final Set<SubmissionState> ACTIVE = EnumSet.of(
            SubmissionState.REQUESTED, SubmissionState.ACKNOWLEDGED, SubmissionState.GRADING);
    private static final Set<SubmissionState> GRADABLE = EnumSet.of(
            SubmissionState.ACKNOWLEDGED, SubmissionState.GRADING);
    private static final Set<SubmissionState> GRADING_ONLY = EnumSet.of(SubmissionState.GRADING);

    private final ScheduledExecutorService timers;
    private final long ackTimeoutMs;
    private final Consumer<String> onAckExpired;

    private SubmissionState state;
    private volatile String current;
    private Integer batchId;
    private boolean inBatch;
    private AckDeadline ackDeadline;

    public SubmissionLifecycle(ScheduledExecutorService timers, long ackTimeoutMs, Consumer<String> onAckExpired) {
        this.timers = timers;
        this.ackTimeoutMs = ackTimeoutMs;
        this.onAckExpired = onAckExpired;
        this.state = SubmissionState.IDLE;
    }

    public synchronized boolean request(String submissionId) {
        if (state != SubmissionState.IDLE) {
            return false;
        }
        current = submissionId;
        state = SubmissionState.REQUESTED;
        batchId = null;
        inBatch = false;
        ackDeadline = AckDeadline.arm(timers, ackTimeoutMs, () -> onAckExpired.accept(submissionId));
        return true;
    }

    public synchronized void cancelRequest(String submissionId) {
        if (submissionId.equals(current) && state == SubmissionState.REQUESTED) {
            finish();
        }
    }

    public synchronized Outcome acknowledge(String submissionId) {
        Outcome check = check(submissionId, EnumSet.of(SubmissionState.REQUESTED));
        if (check != Outcome.APPLIED) {
            return check;
        }
        if (ackDeadline != null && !ackDeadline.disarm()) {
            return Outcome.EXPIRED;
        }
        ackDeadline = null;
        state = SubmissionState.ACKNOWLEDGED;
        return Outcome.APPLIED;
    }

    public synchronized Outcome gradingBegin(String submissionId) {
        Outcome check = check(submissionId, GRADABLE);
        if (check == Outcome.APPLIED) {
            state = SubmissionState.GRADING;
            batchId = null;
            inBatch = false;
        }
        return check;
    }

    public synchronized Outcome batchBegin(String submissionId, Integer batchNo) {
        Outcome check = check(submissionId, GRADING_ONLY);
        if (check == Outcome.APPLIED) {
            inBatch = true;
            // Judges that do not number their batches get consecutive ids per grading run.
            if (batchNo != null) {
                batchId = batchNo;
            } else {
                batchId = batchId == null ? 1 : batchId + 1;
            }
        }
        return check;
    }

    public synchronized Outcome batchEnd(String submissionId) {
        Outcome check = check(submissionId, GRADING_ONLY);
        if (check != Outcome.APPLIED) {
            return check;
        }
        if (!inBatch) {
            return Outcome.WRONG_STATE;
        }
        inBatch = false;
        return Outcome.APPLIED;
    }

    public synchronized Outcome testCase(String submissionId) {
        return check(submissionId, GRADING_ONLY);
    }

    public synchronized Outcome compileMessage(String submissionId) {
        return check(submissionId, ACTIVE);
    }

    public synchronized Outcome compileError(String submissionId) {
        return terminal(submissionId, ACTIVE);
    }

    public synchronized Outcome gradingEnd(String submissionId) {
        return terminal(submissionId, GRADING_ONLY);
    }

    public synchronized Outcome internalError(String submissionId) {
        return terminal(submissionId, ACTIVE);
    }

    public synchronized Outcome terminated(String submissionId) {
        return terminal(submissionId, ACTIVE);
    }

    // Returns the dropped id, if any.
    public synchronized String reset() {
        String lost = current;
        finish();
        return lost;
    }

    public String currentSubmission() {
        return current;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, current, batchId, inBatch);
    }

    private Outcome terminal(String submissionId, Set<SubmissionState> allowed) {
        Outcome check = check(submissionId, allowed);
        if (check == Outcome.APPLIED) {
            finish();
        }
        return check;
    }

    private Outcome check(String submissionId, Set<SubmissionState> allowed) {
        if (current == null) {
            return Outcome.NO_SUBMISSION;
        }
        if (!current.equals(submissionId)) {
            return Outcome.ID_MISMATCH;
        }
        return allowed.contains(state) ? Outcome.APPLIED : Outcome.WRONG_STATE;
    }

    private void finish() {
        if (ackDeadline != null) {
            ackDeadline.disarm();
            ackDeadline = null;
        }
        current = null;
        state = SubmissionState.IDLE;
        batchId = null;
        inBatch = false;
    }

    public enum Outcome {
        APPLIED,
        NO_SUBMISSION,
        ID_MISMATCH,
        WRONG_STATE,
        EXPIRED
    }

    public record Snapshot(SubmissionState state, String currentSubmission, Integer batchId, boolean inBatch) {
    }
}
