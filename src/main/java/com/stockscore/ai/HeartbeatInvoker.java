package com.stockscore.ai;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one blocking call on a single-use background thread and waits for it in
 * short polls, emitting a heartbeat while the call is outstanding.
 * <p>
 * Timeout is cooperative: the abandoned task is cancelled with interruption, but
 * the transport may ignore that. Its late result is never observed because every
 * invocation owns its own executor and future.
 */
public final class HeartbeatInvoker {
    private static final Logger LOG = LogManager.getLogger(HeartbeatInvoker.class);
    private static final AtomicLong SLOT_SEQ = new AtomicLong();

    @FunctionalInterface
    public interface HeartbeatListener {
        /**
         * @param remaining remaining budget, or {@code null} when no timeout is configured
         */
        void onHeartbeat(String label, Duration elapsed, Duration remaining);
    }

    public static final HeartbeatListener LOGGING_LISTENER = (label, elapsed, remaining) -> {
        if (remaining == null) {
            LOG.info("still waiting for {} elapsed={}s", label, elapsed.toSeconds());
        } else {
            LOG.info("still waiting for {} elapsed={}s remaining={}s", label, elapsed.toSeconds(), remaining.toSeconds());
        }
    };

    private final long pollNanos;
    private final long heartbeatNanos;
    private final long timeoutNanos;
    private final HeartbeatListener listener;

    /**
     * @param timeout zero or negative disables the budget
     * @param heartbeatInterval zero or negative disables heartbeats
     */
    public HeartbeatInvoker(Duration pollInterval, Duration heartbeatInterval, Duration timeout, HeartbeatListener listener) {
        this.pollNanos = Math.max(TimeUnit.MILLISECONDS.toNanos(1), nanos(pollInterval));
        this.heartbeatNanos = Math.max(0L, nanos(heartbeatInterval));
        this.timeoutNanos = Math.max(0L, nanos(timeout));
        this.listener = listener == null ? LOGGING_LISTENER : listener;
    }

    public HeartbeatInvoker(Duration pollInterval, Duration heartbeatInterval, Duration timeout) {
        this(pollInterval, heartbeatInterval, timeout, LOGGING_LISTENER);
    }

    public Duration timeout() {
        return Duration.ofNanos(timeoutNanos);
    }

    public <T> T invoke(String label, Callable<T> call)
            throws InvocationTimeoutException, ExecutionException, InterruptedException {
        String safeLabel = label == null || label.isBlank() ? "model call" : label;
        ExecutorService slot = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "model-call-" + SLOT_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        long startedNanos = System.nanoTime();
        Future<T> future;
        try {
            future = slot.submit(call);
        } finally {
            slot.shutdown();
        }

        long nextHeartbeatNanos = heartbeatNanos;
        boolean settled = false;
        try {
            while (true) {
                long elapsed = System.nanoTime() - startedNanos;
                long wait = pollNanos;
                if (timeoutNanos > 0L) {
                    wait = Math.max(1L, Math.min(wait, timeoutNanos - elapsed));
                }
                try {
                    T value = future.get(wait, TimeUnit.NANOSECONDS);
                    settled = true;
                    return value;
                } catch (ExecutionException e) {
                    settled = true;
                    throw e;
                } catch (TimeoutException stillRunning) {
                    elapsed = System.nanoTime() - startedNanos;
                }

                if (timeoutNanos > 0L && elapsed >= timeoutNanos) {
                    LOG.warn("abandoning {} after {}ms", safeLabel, TimeUnit.NANOSECONDS.toMillis(elapsed));
                    throw new InvocationTimeoutException(safeLabel, Duration.ofNanos(timeoutNanos), Duration.ofNanos(elapsed));
                }
                if (heartbeatNanos > 0L && elapsed >= nextHeartbeatNanos) {
                    Duration remaining = timeoutNanos > 0L ? Duration.ofNanos(timeoutNanos - elapsed) : null;
                    listener.onHeartbeat(safeLabel, Duration.ofNanos(elapsed), remaining);
                    nextHeartbeatNanos = (elapsed / heartbeatNanos + 1L) * heartbeatNanos;
                }
            }
        } finally {
            if (!settled) {
                future.cancel(true);
            }
        }
    }

    private static long nanos(Duration d) {
        return d == null ? 0L : d.toNanos();
    }
}
