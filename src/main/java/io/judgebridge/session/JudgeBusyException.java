package io.judgebridge.session;

public final class JudgeBusyException extends IllegalStateException {
    private final String judge;
    private final String currentSubmission;

    public JudgeBusyException(String judge, String currentSubmission) {
        super("Judge " + judge + " is already working on submission " + currentSubmission);
        this.judge = judge;
        this.currentSubmission = currentSubmission;
    }

    public String judge() {
        return judge;
    }

    public String currentSubmission() {
        return currentSubmission;
    }
}
