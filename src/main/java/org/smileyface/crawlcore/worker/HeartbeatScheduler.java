package org.smileyface.crawlcore.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs periodic liveness tasks (claim heartbeats, run touches) on a small shared pool.
 * Each task is cancelled by closing the handle returned from {@link #schedule}.
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final ScheduledExecutorService executor;

    public HeartbeatScheduler(int threads) {
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "heartbeat-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Handle schedule(Runnable task, Duration interval) {
        long ms = Math.max(1, interval.toMillis());
        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // a thrown exception would silently cancel the schedule
                log.warn("Heartbeat task failed: {}", e.getMessage(), e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        return new Handle(future);
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    public static final class Handle implements AutoCloseable {
        private final ScheduledFuture<?> future;

        private Handle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void close() {
            future.cancel(false);
        }
    }
}
