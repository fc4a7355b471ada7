package io.judgebridge.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

// Sends pings only. The transport's inactivity timeout owns liveness.
public final class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    // Load reported before the first ping-response: treat the judge as fully busy.
    public static final double UNKNOWN_LOAD = Double.MAX_VALUE;

    private final String judge;
    private final int windowSize;
    private final long periodMs;
    private final DoubleSupplier nowSeconds;
    private final PingSender sender;
    private final Runnable onFatal;
    private final SampleWindow latencies;
    private final SampleWindow offsets;
    private final ArrayDeque<Double> outstanding;
    private final CountDownLatch stopSignal;
    private final AtomicBoolean started;
    private volatile Snapshot snapshot;

    public HealthMonitor(
            String judge,
            int windowSize,
            long periodMs,
            DoubleSupplier nowSeconds,
            PingSender sender,
            Runnable onFatal
    ) {
        this.judge = judge;
        this.windowSize = Math.max(1, windowSize);
        this.periodMs = Math.max(1L, periodMs);
        this.nowSeconds = nowSeconds;
        this.sender = sender;
        this.onFatal = onFatal;
        this.latencies = new SampleWindow(windowSize);
        this.offsets = new SampleWindow(windowSize);
        this.outstanding = new ArrayDeque<>();
        this.stopSignal = new CountDownLatch(1);
        this.started = new AtomicBoolean(false);
        this.snapshot = new Snapshot(null, null, UNKNOWN_LOAD, 0);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::run, "judge-ping-" + judge);
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean stopped() {
        return stopSignal.getCount() == 0L;
    }

    private void run() {
        try {
            while (!stopped()) {
                double when = nowSeconds.getAsDouble();
                pingSent(when);
                sender.ping(when);
                if (stopSignal.await(periodMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (stopped()) {
                return;
            }
            log.error("Ping error in {}", judge, e);
            stop();
            onFatal.run();
        }
    }

    synchronized void pingSent(double whenSeconds) {
        if (outstanding.size() >= windowSize) {
            outstanding.pollFirst();
        }
        outstanding.addLast(whenSeconds);
    }

    /**
     * Folds one ping round trip into the estimates.
     *
     * @return {@code false} if {@code sentSeconds} echoes no outstanding ping, or the sample
     *         is impossible; the sample is then ignored
     */
    public synchronized boolean record(double sentSeconds, double receivedSeconds, double workerSeconds, double load) {
        double latency = receivedSeconds - sentSeconds;
        if (!Double.isFinite(latency) || latency < 0.0 || !Double.isFinite(workerSeconds)) {
            return false;
        }
        if (!outstanding.remove(sentSeconds)) {
            return false;
        }
        latencies.add(latency);
        offsets.add((receivedSeconds + sentSeconds) / 2.0 - workerSeconds);
        snapshot = new Snapshot(latencies.mean(), offsets.mean(), load, latencies.size());
        return true;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public int windowCapacity() {
        return latencies.capacity();
    }

    @FunctionalInterface
    public interface PingSender {
        void ping(double whenSeconds) throws Exception;
    }

    // Estimates are null before the first sample.
    public record Snapshot(Double latencySeconds, Double clockOffsetSeconds, double load, int samples) {
    }
}
