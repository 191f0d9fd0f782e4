package com.example.boundedcache.core;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that periodically removes expired entries through
 * {@link BoundedCache#expireAll()}. Reads already hide expired entries, so the sweeper only
 * reclaims their memory earlier.
 */
public class ExpirationSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweeper.class);

    static final String THREAD_NAME = "bounded-cache-sweeper";

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000;

    private final BoundedCache<?> cache;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private volatile Thread worker;

    ExpirationSweeper(BoundedCache<?> cache, Duration interval) {
        this.cache = cache;
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            worker = t;
            return t;
        });
    }

    void start() {
        long millis = Math.max(1, interval.toMillis());
        executor.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Expiration sweeper started, interval={}", interval);
    }

    private void sweep() {
        try {
            int removed = cache.expireAll();
            if (removed > 0) {
                log.debug("Sweep removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            // a throwing task would cancel every later run
            log.error("Expiration sweep failed", e);
        }
    }

    public boolean isRunning() {
        return !executor.isShutdown();
    }

    /**
     * Stops the sweeper. When this returns no sweep is running and none will start, unless it is
     * called from a sweep itself, in which case that sweep finishes normally.
     */
    @Override
    public void close() {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        if (Thread.currentThread() == worker) {
            return;
        }
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Expiration sweeper did not stop within {} ms, interrupting", SHUTDOWN_TIMEOUT_MILLIS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Expiration sweeper stopped");
    }
}
