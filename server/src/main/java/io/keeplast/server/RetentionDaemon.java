package io.keeplast.server;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background task that periodically purges patches older than the retention window.
 * Runs on a single daemon thread; a failed purge is logged and retried on the next tick.
 */
public final class RetentionDaemon {

    private static final Logger log = Logger.getLogger(RetentionDaemon.class.getName());

    private final PatchService service;
    private final Duration retention;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public RetentionDaemon(PatchService service, Duration retention, Duration interval) {
        this.service = Objects.requireNonNull(service, "service");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-daemon");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(
                this::tickSafe,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /** Run one purge now. Exposed for tests. */
    int tick() {
        return service.purge(retention);
    }

    private void tickSafe() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "patch purge failed", e);
        }
    }
}
