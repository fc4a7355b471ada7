package io.judgebridge.session;

import io.judgebridge.model.SessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

public final class JudgeRegistry implements SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(JudgeRegistry.class);

    private final Map<String, JudgeSession> sessions = new ConcurrentHashMap<>();
    private final List<Consumer<JudgeSession>> readyListeners = new CopyOnWriteArrayList<>();

    @Override
    public void register(JudgeSession session) {
        JudgeSession previous = sessions.put(session.name(), session);
        if (previous != null && previous != session) {
            log.warn("Judge {} reconnected from {}; replacing session from {}",
                    session.name(), session.address(), previous.address());
        }
        notifyReady(session);
    }

    @Override
    public void unregister(JudgeSession session) {
        String name = session.name();
        if (name != null && sessions.remove(name, session)) {
            log.info("Judge {} left the pool", name);
        }
    }

    @Override
    public void sessionUpdated(JudgeSession session) {
        if (sessions.get(session.name()) == session && !session.working()) {
            notifyReady(session);
        }
    }

    public void onReady(Consumer<JudgeSession> listener) {
        readyListeners.add(listener);
    }

    public Optional<JudgeSession> find(String name) {
        return Optional.ofNullable(name == null ? null : sessions.get(name));
    }

    // Least loaded first.
    public List<JudgeSession> findIdle(String problem, String executor, String targetJudge) {
        List<JudgeSession> out = new ArrayList<>();
        for (JudgeSession session : sessions.values()) {
            if (!session.working() && !session.disconnected() && session.canJudge(problem, executor, targetJudge)) {
                out.add(session);
            }
        }
        out.sort(Comparator.comparingDouble(JudgeSession::load));
        return out;
    }

    public List<SessionView> snapshot() {
        List<SessionView> out = new ArrayList<>();
        for (JudgeSession session : sessions.values()) {
            out.add(session.view());
        }
        out.sort(Comparator.comparing(SessionView::judge));
        return out;
    }

    public int size() {
        return sessions.size();
    }

    public void disconnectAll(boolean force) {
        for (JudgeSession session : List.copyOf(sessions.values())) {
            session.disconnect(force);
        }
    }

    private void notifyReady(JudgeSession session) {
        for (Consumer<JudgeSession> listener : readyListeners) {
            try {
                listener.accept(session);
            } catch (RuntimeException e) {
                log.error("Ready listener failed for judge {}", session.name(), e);
            }
        }
    }
}
