package io.judgebridge.session;

import io.judgebridge.model.ResultEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

// Streaming updates are dropped when full; terminal events wait up to terminalWaitMs first.
public final class BoundedResultSink implements ResultSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedResultSink.class);

    private final ResultSink delegate;
    private final BlockingQueue<Delivery> queue;
    private final long terminalWaitMs;
    private final AtomicLong dropped;
    private final Thread worker;
    private volatile boolean running;

    public BoundedResultSink(ResultSink delegate, int capacity, long terminalWaitMs) {
        this.delegate = delegate;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.terminalWaitMs = Math.max(0L, terminalWaitMs);
        this.dropped = new AtomicLong(0L);
        this.running = true;
        this.worker = new Thread(this::drainLoop, "result-sink");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void notifyResult(String judge, String submissionId, ResultEvent event) {
        Delivery delivery = new Delivery(judge, submissionId, event);
        boolean queued;
        if (event.terminal()) {
            try {
                queued = queue.offer(delivery, terminalWaitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                queued = false;
            }
        } else {
            queued = queue.offer(delivery);
        }
        if (!queued) {
            dropped.incrementAndGet();
            if (event.terminal()) {
                log.error("Result queue full, dropped terminal {} for submission {} from {}", event.type(), submissionId, judge);
            } else {
                log.warn("Result queue full, dropped {} for submission {} from {}", event.type(), submissionId, judge);
            }
        }
    }

    public long dropped() {
        return dropped.get();
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            Delivery next;
            try {
                next = queue.poll(100L, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next == null) {
                continue;
            }
            try {
                delegate.notifyResult(next.judge(), next.submissionId(), next.event());
            } catch (RuntimeException e) {
                log.error("Result sink failed for submission {} ({})", next.submissionId(), next.event().type(), e);
            }
        }
    }

    @Override
    public void close() {
        running = false;
        try {
            worker.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Delivery(String judge, String submissionId, ResultEvent event) {
    }
}
