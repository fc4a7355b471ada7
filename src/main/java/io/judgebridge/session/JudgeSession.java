package io.judgebridge.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.judgebridge.config.BridgeSettings;
import io.judgebridge.model.ResultEvent;
import io.judgebridge.model.ResultEventType;
import io.judgebridge.model.SessionView;
import io.judgebridge.model.SubmissionDispatchRequest;
import io.judgebridge.observability.AuditLogger;
import io.judgebridge.protocol.InboundMessage;
import io.judgebridge.protocol.MessageDecoder;
import io.judgebridge.protocol.OutboundMessages;
import io.judgebridge.security.SensitiveDataMasker;
import io.judgebridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class JudgeSession implements InboundMessage.Visitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(JudgeSession.class);
    private static final int MAX_JUDGE_NAME_CHARS = 128;

    private final Transport transport;
    private final SessionContext context;
    private final BridgeSettings settings;
    private final MessageDecoder decoder;
    private final SubmissionLifecycle lifecycle;
    private final ResultRateLimiter rateLimiter;
    private final Object emitLock;
    private final AtomicBoolean disconnected;
    private final String address;
    private final long connectedAtMs;
    private volatile String name;
    private volatile Set<String> problems;
    private volatile Map<String, JsonNode> executors;
    private volatile boolean accepting;
    private volatile HealthMonitor healthMonitor;

    public JudgeSession(Transport transport, SessionContext context) {
        this.transport = transport;
        this.context = context;
        this.settings = context.settings();
        this.decoder = new MessageDecoder(settings.maxProblemListSize());
        this.lifecycle = new SubmissionLifecycle(context.timers(), settings.ackTimeoutMs(), this::onAckExpired);
        this.rateLimiter = new ResultRateLimiter(
                settings.updateRateLimit(),
                settings.updateRateWindowMs(),
                () -> context.clock().millis()
        );
        this.emitLock = new Object();
        this.disconnected = new AtomicBoolean(false);
        this.address = transport.remoteAddress();
        this.connectedAtMs = context.clock().millis();
        this.problems = Set.of();
        this.executors = Map.of();
        this.accepting = true;
    }

    public void onConnect() {
        transport.setTimeout(settings.handshakeTimeoutMs());
        log.info("Judge connected from: {}", address);
        audit("judge.connect", null, "ok", Map.of());
    }

    public void onPacket(String raw) {
        try {
            InboundMessage message = decoder.decode(raw);
            if (name == null && !(message instanceof InboundMessage.Handshake)) {
                log.warn("Judge at {} sent a packet before handshake, closing", address);
                audit("judge.handshake", null, "missing", Map.of("packet", SensitiveDataMasker.maskedPacket(raw)));
                forceClose();
                return;
            }
            message.accept(this);
        } catch (RuntimeException e) {
            // One bad packet must not take the session down.
            String current = lifecycle.currentSubmission();
            log.error("Error in packet handling (judge-side): {} on submission {}", name, current, e);
            audit("judge.packet.exception", current, "error", Map.of(
                    "error", String.valueOf(e.getMessage()),
                    "type", e.getClass().getName()
            ));
        }
    }

    public void onTimeout() {
        String current = lifecycle.currentSubmission();
        if (name != null) {
            log.warn("Judge seems dead: {}: {}", name, current);
        } else {
            log.warn("Judge at {} did not complete handshake in time", address);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("authenticated", name != null);
        audit("judge.timeout", current, "timeout", details);
    }

    // Idempotent.
    public void onDisconnect() {
        if (!disconnected.compareAndSet(false, true)) {
            return;
        }
        HealthMonitor monitor = healthMonitor;
        if (monitor != null) {
            monitor.stop();
        }
        String lost = lifecycle.reset();
        rateLimiter.clear();
        if (lost != null) {
            log.error("Judge {} disconnected while handling submission {}", name, lost);
            audit("judge.submission.lost", lost, "reschedule", Map.of());
            try {
                context.scheduler().rescheduleSubmission(name, lost);
            } catch (RuntimeException e) {
                log.error("Scheduler failed to take back submission {} from {}", lost, name, e);
            }
        }
        if (name != null) {
            context.registry().unregister(this);
        }
        transport.close();
        log.info("Judge disconnected from: {} with name {}", address, name);
        audit("judge.disconnect", null, "ok", Map.of());
    }

    /**
     * Sends a submission to this judge.
     *
     * @throws JudgeBusyException                 if a submission is already in flight; nothing is sent
     * @throws SubmissionDataUnavailableException if the submission store has no usable metadata
     * @throws IllegalStateException              if the judge has not authenticated or is gone
     */
    public void submit(String submissionId, String problemId, String language, String source) {
        if (submissionId == null || submissionId.isBlank()) {
            throw new IllegalArgumentException("submission id is required");
        }
        if (name == null || disconnected.get()) {
            throw new IllegalStateException("Judge session is not ready: " + address);
        }
        String busy = lifecycle.currentSubmission();
        if (busy != null) {
            throw new JudgeBusyException(name, busy);
        }
        SubmissionDispatchRequest data = fetchDispatchData(submissionId);
        if (!lifecycle.request(submissionId)) {
            throw new JudgeBusyException(name, lifecycle.currentSubmission());
        }
        try {
            transport.send(OutboundMessages.submissionRequest(submissionId, problemId, language, source, data));
        } catch (RuntimeException e) {
            lifecycle.cancelRequest(submissionId);
            throw e;
        }
        log.info("Dispatched submission {} to {}", submissionId, name);
    }

    public void abort() {
        log.info("Requesting abort of submission {} on {}", lifecycle.currentSubmission(), name);
        transport.send(OutboundMessages.terminateSubmission());
    }

    public void disconnect(boolean force) {
        if (force) {
            forceClose();
            return;
        }
        try {
            transport.send(OutboundMessages.disconnect());
        } catch (UncheckedIOException e) {
            log.warn("Graceful disconnect of {} failed, closing: {}", name, e.getMessage());
            forceClose();
        }
    }

    private void ping(double whenSeconds) {
        transport.send(OutboundMessages.ping(whenSeconds));
    }

    // ---- inbound handlers ----

    @Override
    public Void handshake(InboundMessage.Handshake message) {
        if (name != null) {
            log.warn("{}: Duplicate handshake ignored", name);
            audit("judge.packet.malformed", lifecycle.currentSubmission(), "duplicate_handshake", Map.of());
            return null;
        }
        String id = message.id() == null ? "" : message.id().trim();
        if (id.isEmpty() || id.length() > MAX_JUDGE_NAME_CHARS || message.key() == null
                || message.problems() == null || message.executors() == null) {
            log.warn("Malformed handshake: {}", address);
            audit("judge.handshake", null, "malformed", Map.of());
            forceClose();
            return null;
        }
        boolean authenticated;
        try {
            authenticated = context.authenticator().authenticate(id, message.key());
        } catch (RuntimeException e) {
            log.error("Authenticator failed for judge {} at {}", id, address, e);
            authenticated = false;
        }
        if (!authenticated) {
            log.warn("Judge authentication failure: {} ({})", address, id);
            audit("judge.handshake", null, "rejected", Map.of("claimed", id));
            forceClose();
            return null;
        }

        transport.setTimeout(settings.sessionTimeoutMs());
        problems = Set.copyOf(message.problems());
        executors = Map.copyOf(message.executors());
        name = id;
        try {
            transport.send(OutboundMessages.handshakeSuccess());
        } catch (UncheckedIOException e) {
            log.warn("Could not confirm handshake to {} ({}): {}", id, address, e.getMessage());
            forceClose();
            return null;
        }
        log.info("Judge authenticated: {} ({})", address, id);
        audit("judge.handshake", null, "ok", Map.of(
                "problems", problems.size(),
                "executors", executors.size()
        ));

        HealthMonitor monitor = new HealthMonitor(
                id,
                settings.healthWindowSize(),
                settings.pingIntervalMs(),
                this::nowSeconds,
                this::ping,
                this::forceClose
        );
        healthMonitor = monitor;
        if (disconnected.get()) {
            return null;
        }
        monitor.start();
        context.registry().register(this);
        // A disconnect that ran between the check above and register() found nothing to remove.
        if (disconnected.get()) {
            context.registry().unregister(this);
        }
        return null;
    }

    @Override
    public Void submissionAcknowledged(InboundMessage.SubmissionAcknowledged message) {
        String expected = lifecycle.currentSubmission();
        SubmissionLifecycle.Outcome outcome = lifecycle.acknowledge(message.submissionId());
        if (outcome == SubmissionLifecycle.Outcome.APPLIED) {
            log.info("{}: Submission acknowledged: {}", name, message.submissionId());
        } else if (outcome == SubmissionLifecycle.Outcome.ID_MISMATCH) {
            log.error("{}: Wrong acknowledgement: expected {}, got {}", name, expected, message.submissionId());
            audit("judge.protocol.violation", expected, "wrong_ack", Map.of("got", message.submissionId()));
        } else {
            violation("submission-acknowledged", message.submissionId(), outcome);
        }
        return null;
    }

    @Override
    public Void gradingBegin(InboundMessage.GradingBegin message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.gradingBegin(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("grading-begin", id, outcome);
        }
        log.info("{}: Grading has begun on: {}", name, id);
        ObjectNode payload = Jsons.object();
        payload.put("pretested", message.pretested());
        emit(ResultEventType.GRADING_BEGIN, id, payload);
        return null;
    }

    @Override
    public Void gradingEnd(InboundMessage.GradingEnd message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.gradingEnd(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("grading-end", id, outcome);
        }
        log.info("{}: Grading has ended on: {}", name, id);
        emit(ResultEventType.GRADING_END, id, Jsons.object());
        return null;
    }

    @Override
    public Void compileError(InboundMessage.CompileError message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.compileError(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("compile-error", id, outcome);
        }
        log.info("{}: Submission failed to compile: {}", name, id);
        ObjectNode payload = Jsons.object();
        payload.put("log", message.log());
        emit(ResultEventType.COMPILE_ERROR, id, payload);
        return null;
    }

    @Override
    public Void compileMessage(InboundMessage.CompileMessage message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.compileMessage(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("compile-message", id, outcome);
        }
        log.info("{}: Submission generated compiler messages: {}", name, id);
        ObjectNode payload = Jsons.object();
        payload.put("log", message.log());
        emit(ResultEventType.COMPILE_MESSAGE, id, payload);
        return null;
    }

    @Override
    public Void batchBegin(InboundMessage.BatchBegin message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.batchBegin(id, message.batchNo());
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("batch-begin", id, outcome);
        }
        ObjectNode payload = Jsons.object();
        Integer batch = lifecycle.snapshot().batchId();
        if (batch == null) {
            payload.putNull("batch");
        } else {
            payload.put("batch", batch);
        }
        emit(ResultEventType.BATCH_BEGIN, id, payload);
        return null;
    }

    @Override
    public Void batchEnd(InboundMessage.BatchEnd message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.batchEnd(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("batch-end", id, outcome);
        }
        emit(ResultEventType.BATCH_END, id, Jsons.object());
        return null;
    }

    @Override
    public Void testCaseStatus(InboundMessage.TestCaseStatus message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.testCase(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("test-case-status", id, outcome);
        }
        SubmissionLifecycle.Snapshot state = lifecycle.snapshot();
        ObjectNode payload = Jsons.object();
        if (state.inBatch() && state.batchId() != null) {
            payload.put("batch", state.batchId());
        } else {
            payload.putNull("batch");
        }
        ArrayNode cases = payload.putArray("cases");
        for (JsonNode raw : message.cases()) {
            cases.add(capFeedback(raw));
        }
        ResultEvent event = new ResultEvent(ResultEventType.TEST_CASE, id, payload, context.clock().millis());
        synchronized (emitLock) {
            ResultRateLimiter.Admission admission = rateLimiter.offer(event);
            if (admission.forwarded()) {
                deliver(admission.forward());
            } else if (admission.scheduleFlush()) {
                scheduleFlush(id, admission.retryAfterMs());
            }
        }
        return null;
    }

    @Override
    public Void internalError(InboundMessage.InternalError message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.internalError(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("internal-error", id, outcome);
        }
        log.error("{}: Judge had internal error while grading {}: {}", name, id, message.message());
        ObjectNode payload = Jsons.object();
        payload.put("message", message.message());
        emit(ResultEventType.INTERNAL_ERROR, id, payload);
        try {
            context.scheduler().submissionNeedsAttention(name, id, message.message());
        } catch (RuntimeException e) {
            log.error("Scheduler failed to accept internal error for {} from {}", id, name, e);
        }
        return null;
    }

    @Override
    public Void submissionTerminated(InboundMessage.SubmissionTerminated message) {
        String id = message.submissionId();
        SubmissionLifecycle.Outcome outcome = lifecycle.terminated(id);
        if (outcome != SubmissionLifecycle.Outcome.APPLIED) {
            return violation("submission-terminated", id, outcome);
        }
        log.info("{}: Submission aborted: {}", name, id);
        emit(ResultEventType.ABORTED, id, Jsons.object());
        return null;
    }

    @Override
    public Void pingResponse(InboundMessage.PingResponse message) {
        HealthMonitor monitor = healthMonitor;
        if (monitor == null) {
            return null;
        }
        if (!monitor.record(message.when(), nowSeconds(), message.time(), message.load())) {
            log.warn("{}: Unsolicited or implausible ping-response ignored (when={})", name, message.when());
            return null;
        }
        context.registry().sessionUpdated(this);
        return null;
    }

    @Override
    public Void supportedProblems(InboundMessage.SupportedProblems message) {
        if (message.problems() == null) {
            log.error("{}: Malformed supported-problems packet", name);
            audit("judge.packet.malformed", lifecycle.currentSubmission(), "supported-problems", Map.of());
            return null;
        }
        problems = Set.copyOf(message.problems());
        log.info("{}: Updated problem list ({} problems)", name, problems.size());
        context.registry().sessionUpdated(this);
        return null;
    }

    @Override
    public Void unrecognized(InboundMessage.Unrecognized message) {
        String current = lifecycle.currentSubmission();
        log.error("{}: Malformed packet ({}): {}", name, message.reason(), SensitiveDataMasker.maskedPacket(message.raw()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", message.reason());
        details.put("packet_name", message.name());
        audit("judge.packet.malformed", current, "malformed", details);
        return null;
    }

    // ---- accessors for the registry and scheduler ----

    public String name() {
        return name;
    }

    public String address() {
        return address;
    }

    public boolean authenticated() {
        return name != null;
    }

    public boolean disconnected() {
        return disconnected.get();
    }

    public String currentSubmission() {
        return lifecycle.currentSubmission();
    }

    public boolean working() {
        return lifecycle.currentSubmission() != null;
    }

    public SubmissionLifecycle.Snapshot lifecycleState() {
        return lifecycle.snapshot();
    }

    public HealthMonitor.Snapshot health() {
        HealthMonitor monitor = healthMonitor;
        return monitor == null ? new HealthMonitor.Snapshot(null, null, HealthMonitor.UNKNOWN_LOAD, 0) : monitor.snapshot();
    }

    public double load() {
        return health().load();
    }

    public Set<String> problems() {
        return problems;
    }

    public Map<String, JsonNode> executors() {
        return executors;
    }

    public boolean accepting() {
        return accepting;
    }

    // Drain mode: only work targeted at this judge by name is eligible.
    public void setAccepting(boolean value) {
        if (accepting != value) {
            accepting = value;
            log.info("Judge {} {} general work", name, value ? "now accepts" : "no longer accepts");
            if (name != null) {
                context.registry().sessionUpdated(this);
            }
        }
    }

    public boolean canJudge(String problem, String executor, String targetJudge) {
        if (!problems.contains(problem) || !executors.containsKey(executor)) {
            return false;
        }
        if (targetJudge == null || targetJudge.isBlank()) {
            return accepting;
        }
        return targetJudge.equals(name);
    }

    public SessionView view() {
        HealthMonitor.Snapshot health = health();
        SubmissionLifecycle.Snapshot state = lifecycle.snapshot();
        return new SessionView(
                name,
                address,
                state.currentSubmission(),
                state.state(),
                accepting,
                health.latencySeconds(),
                health.clockOffsetSeconds(),
                health.load(),
                problems.size(),
                Set.copyOf(executors.keySet()),
                connectedAtMs
        );
    }

    // ---- internals ----

    private void onAckExpired(String submissionId) {
        log.error("Judge failed to acknowledge submission: {}: {}", name, submissionId);
        audit("judge.ack.timeout", submissionId, "error", Map.of("ack_timeout_ms", settings.ackTimeoutMs()));
        forceClose();
    }

    private void forceClose() {
        transport.close();
        onDisconnect();
    }

    private SubmissionDispatchRequest fetchDispatchData(String submissionId) {
        Future<Optional<SubmissionDispatchRequest>> lookup;
        try {
            lookup = context.storeCalls().submit(() -> context.submissionStore().fetch(submissionId));
        } catch (RejectedExecutionException e) {
            throw new SubmissionDataUnavailableException(submissionId, "store executor unavailable", e);
        }
        Optional<SubmissionDispatchRequest> data;
        try {
            data = lookup.get(settings.storeTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new SubmissionDataUnavailableException(
                    submissionId, "lookup timed out after " + settings.storeTimeoutMs() + "ms", e);
        } catch (ExecutionException e) {
            throw new SubmissionDataUnavailableException(submissionId, "lookup failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubmissionDataUnavailableException(submissionId, "interrupted", e);
        }
        if (data == null || data.isEmpty()) {
            throw new SubmissionDataUnavailableException(submissionId, "not found");
        }
        return data.get();
    }

    private Void violation(String event, String submissionId, SubmissionLifecycle.Outcome outcome) {
        String current = lifecycle.currentSubmission();
        log.warn("{}: Ignoring {} for {} ({}), current submission {}", name, event, submissionId, outcome, current);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("event", event);
        details.put("outcome", outcome.name());
        details.put("packet_submission", submissionId);
        audit("judge.protocol.violation", current, "ignored", details);
        return null;
    }

    private JsonNode capFeedback(JsonNode raw) {
        if (!raw.isObject()) {
            return raw;
        }
        ObjectNode copy = ((ObjectNode) raw).deepCopy();
        copy.remove(List.of("name", "submission-id"));
        JsonNode feedback = copy.get("feedback");
        if (feedback != null && feedback.isTextual()) {
            String text = feedback.asText();
            int max = settings.maxFeedbackLength();
            if (text.length() > max) {
                copy.put("feedback", text.substring(0, max));
            }
        }
        return copy;
    }

    private void emit(ResultEventType type, String submissionId, JsonNode payload) {
        ResultEvent event = new ResultEvent(type, submissionId, payload, context.clock().millis());
        synchronized (emitLock) {
            // A held test-case result stays under the window cap until the boundary flush,
            // except before a terminal event, which must be the last thing delivered.
            if (type.terminal()) {
                rateLimiter.drain(submissionId).ifPresent(this::deliver);
            }
            deliver(event);
        }
    }

    private void scheduleFlush(String submissionId, long delayMs) {
        try {
            context.timers().schedule(() -> flushDeferred(submissionId), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Deferred flush for {} not scheduled: timers shut down", submissionId);
        }
    }

    private void flushDeferred(String submissionId) {
        synchronized (emitLock) {
            Optional<ResultEvent> due = rateLimiter.flushDue(submissionId);
            if (due.isPresent()) {
                deliver(due.get());
            } else if (rateLimiter.hasPending(submissionId) && !disconnected.get()) {
                // Window was refreshed by a later update; try again when it closes.
                scheduleFlush(submissionId, settings.updateRateWindowMs());
            }
        }
    }

    private void deliver(ResultEvent event) {
        try {
            context.resultSink().notifyResult(name, event.submissionId(), event);
        } catch (RuntimeException e) {
            log.error("Result sink rejected {} for submission {} from {}", event.type(), event.submissionId(), name, e);
        }
    }

    private void audit(String action, String submission, String result, Map<String, Object> details) {
        AuditLogger audit = context.audit();
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, name, address, submission, result, details));
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {}: {}", action, e.getMessage());
        }
    }

    private double nowSeconds() {
        return context.clock().millis() / 1000.0;
    }

    @Override
    public String toString() {
        return "JudgeSession{" + name + "@" + address + "}";
    }
}
