package io.judgebridge.session;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class AckDeadline {
    private final AtomicBoolean settled;
    private volatile ScheduledFuture<?> future;

    private AckDeadline() {
        this.settled = new AtomicBoolean(false);
    }

    static AckDeadline arm(ScheduledExecutorService timers, long delayMs, Runnable onExpire) {
        AckDeadline deadline = new AckDeadline();
        deadline.future = timers.schedule(() -> {
            if (deadline.settled.compareAndSet(false, true)) {
                onExpire.run();
            }
        }, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        return deadline;
    }

    // True if the timer had not fired yet and never will.
    boolean disarm() {
        boolean won = settled.compareAndSet(false, true);
        ScheduledFuture<?> scheduled = future;
        if (won && scheduled != null) {
            scheduled.cancel(false);
        }
        return won;
    }
}
