package com.threatsentinel.core;

import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.escalation.EscalationService;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping off the hot path: counter sweep, event retention and
 * the stale open alert check.
 *
 * <p>
 * Runs on a single daemon thread every
 * {@link SiemConfig#getMaintenanceIntervalSeconds()} seconds once
 * {@link #start() started}.
 * </p>
 *
 * @since 1.0.0
 */
public class MaintenanceScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final SiemConfig config;
    private final WindowCounterStore counters;
    private final EventBuffer buffer;
    private final EscalationService escalation;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    public MaintenanceScheduler(SiemConfig config, WindowCounterStore counters, EventBuffer buffer,
            EscalationService escalation, Clock clock) {
        this.config = Objects.requireNonNull(config, "SiemConfig must not be null");
        this.counters = Objects.requireNonNull(counters, "WindowCounterStore must not be null");
        this.buffer = Objects.requireNonNull(buffer, "EventBuffer must not be null");
        this.escalation = Objects.requireNonNull(escalation, "EscalationService must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "threat-sentinel-maintenance");
            t.setDaemon(true);
            return t;
        });
        int interval = config.getMaintenanceIntervalSeconds();
        scheduler.scheduleAtFixedRate(this::runSafely, interval, interval, TimeUnit.SECONDS);
        LOG.info("Maintenance scheduled every {}s", interval);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        LOG.info("Maintenance stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            LOG.error("Maintenance run failed", e);
        }
    }

    /**
     * Run one maintenance pass immediately.
     *
     * @return OPEN alerts found stale in this pass
     */
    public List<Alert> runOnce() {
        int swept = counters.sweep();
        int pruned = buffer.pruneOlderThan(clock.instant().minus(Duration.ofDays(config.getLogRetentionDays())));
        List<Alert> stale = escalation.staleAlerts(Duration.ofMinutes(config.getStaleAlertMinutes()));
        for (Alert alert : stale) {
            LOG.warn("Alert {} [{}] '{}' has been OPEN since {}", alert.getId(), alert.getSeverity(),
                    alert.getName(), alert.getTimestamp());
        }
        LOG.debug("Maintenance: swept {} counter(s), pruned {} event(s), {} stale alert(s)", swept, pruned,
                stale.size());
        return stale;
    }
}
