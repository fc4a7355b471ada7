package io.judgebridge.model;

public enum ResultEventType {
    GRADING_BEGIN("grading-begin", false),
    BATCH_BEGIN("batch-begin", false),
    BATCH_END("batch-end", false),
    TEST_CASE("test-case", false),
    COMPILE_MESSAGE("compile-message", false),
    COMPILE_ERROR("compile-error", true),
    GRADING_END("grading-end", true),
    INTERNAL_ERROR("internal-error", true),
    ABORTED("aborted", true);

    private final String wireName;
    private final boolean terminal;

    ResultEventType(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    public String wireName() {
        return wireName;
    }

    public boolean terminal() {
        return terminal;
    }
}
