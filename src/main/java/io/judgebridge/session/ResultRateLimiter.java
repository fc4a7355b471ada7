package io.judgebridge.session;

import io.judgebridge.model.ResultEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

public final class ResultRateLimiter {
    private final int limit;
    private final long windowMs;
    private final LongSupplier clockMs;
    private final Map<String, Window> windows;

    public ResultRateLimiter(int limit, long windowMs, LongSupplier clockMs) {
        this.limit = Math.max(1, limit);
        this.windowMs = Math.max(1L, windowMs);
        this.clockMs = clockMs;
        this.windows = new HashMap<>();
    }

    public synchronized Admission offer(ResultEvent event) {
        String submissionId = event.submissionId();
        long nowMs = clockMs.getAsLong();
        Window window = windows.computeIfAbsent(submissionId, ignored -> new Window(nowMs));
        if (nowMs - window.startedAtMs > windowMs) {
            window.reset(nowMs);
        }
        window.count++;
        if (window.count <= limit) {
            window.pending = null;
            return new Admission(event, false, 0L);
        }
        boolean firstDeferral = window.pending == null;
        window.pending = event;
        long retryAfterMs = Math.max(1L, window.startedAtMs + windowMs + 1L - nowMs);
        return new Admission(null, firstDeferral, retryAfterMs);
    }

    // The flushed update counts against the new window.
    public synchronized Optional<ResultEvent> flushDue(String submissionId) {
        Window window = windows.get(submissionId);
        if (window == null || window.pending == null) {
            return Optional.empty();
        }
        long nowMs = clockMs.getAsLong();
        if (nowMs - window.startedAtMs <= windowMs) {
            return Optional.empty();
        }
        ResultEvent pending = window.pending;
        window.reset(nowMs);
        window.count = 1;
        return Optional.of(pending);
    }

    public synchronized Optional<ResultEvent> drain(String submissionId) {
        Window window = windows.remove(submissionId);
        if (window == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(window.pending);
    }

    public synchronized boolean hasPending(String submissionId) {
        Window window = windows.get(submissionId);
        return window != null && window.pending != null;
    }

    public synchronized void clear() {
        windows.clear();
    }

    public synchronized int tracked() {
        return windows.size();
    }

    public record Admission(ResultEvent forward, boolean scheduleFlush, long retryAfterMs) {
        public boolean forwarded() {
            return forward != null;
        }
    }

    private static final class Window {
        private int count;
        private long startedAtMs;
        private ResultEvent pending;

        private Window(long startedAtMs) {
            this.startedAtMs = startedAtMs;
        }

        private void reset(long nowMs) {
            count = 0;
            startedAtMs = nowMs;
        }
    }
}
