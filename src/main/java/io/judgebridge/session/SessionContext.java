package io.judgebridge.session;

import io.judgebridge.config.BridgeSettings;
import io.judgebridge.observability.AuditLogger;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

// audit may be null.
public record SessionContext(
        BridgeSettings settings,
        JudgeAuthenticator authenticator,
        SubmissionStore submissionStore,
        ResultSink resultSink,
        SessionRegistry registry,
        JudgeScheduler scheduler,
        ScheduledExecutorService timers,
        ExecutorService storeCalls,
        AuditLogger audit,
        Clock clock
) {
    public SessionContext {
        if (settings == null) {
            throw new IllegalArgumentException("settings are required");
        }
        if (authenticator == null || submissionStore == null || resultSink == null || registry == null) {
            throw new IllegalArgumentException("authenticator, submission store, result sink and registry are required");
        }
        if (timers == null || storeCalls == null) {
            throw new IllegalArgumentException("timer and store executors are required");
        }
        scheduler = scheduler == null ? JudgeScheduler.noop() : scheduler;
        clock = clock == null ? Clock.systemUTC() : clock;
    }
}
