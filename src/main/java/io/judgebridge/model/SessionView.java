package io.judgebridge.model;

import java.util.Set;

public record SessionView(
        String judge,
        String address,
        String currentSubmission,
        SubmissionState state,
        boolean accepting,
        Double latencySeconds,
        Double clockOffsetSeconds,
        double load,
        int problemCount,
        Set<String> executors,
        long connectedAtMs
) {
    public boolean working() {
        return currentSubmission != null;
    }
}
