/**
 * Per-judge session engine.
 *
 * <p>{@link io.judgebridge.session.JudgeSession} composes the
 * {@link io.judgebridge.session.SubmissionLifecycle} state machine, the
 * {@link io.judgebridge.session.HealthMonitor} heartbeat loop and the
 * {@link io.judgebridge.session.ResultRateLimiter}. Collaborators outside the
 * engine (credential check, submission store, result sink, registry,
 * scheduler) are reached only through the interfaces in this package.
 */
package io.judgebridge.session;
