/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application.healthcheck;

import com.providermanager.application.ProviderNotFoundException;
import com.providermanager.config.AppProperties;
import com.providermanager.domain.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically probes every provider that is due and records the outcome.
 * <p>
 * Per provider: a successful probe resets it to READY with zero failures; a failed probe increments the
 * failure count and flips the provider to NOT_READY once the count reaches
 * {@code maxConsecutiveFailures}. The next check time comes from {@link BackoffCalculator}.
 * <p>
 * Scans run on a single background thread: once at start, then {@code interval} after the previous scan
 * finished. Providers within a scan are probed one after another from the snapshot taken at scan start.
 */
public class HealthMonitor implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);
    public static final String MDC_KEY = "providerId";
    private static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private final ProviderDirectory directory;
    private final LivenessProber prober;
    private final AppProperties.HealthCheck settings;
    private final Clock clock;
    private final Duration stopGrace;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService executor;
    // replaced on every start; a scan only reads the flag of the executor running it
    private volatile AtomicBoolean stopSignal = new AtomicBoolean();

    public HealthMonitor(
            ProviderDirectory directory,
            LivenessProber prober,
            AppProperties.HealthCheck settings,
            Clock clock
    ) {
        this(directory, prober, settings, clock, STOP_GRACE);
    }

    HealthMonitor(
            ProviderDirectory directory,
            LivenessProber prober,
            AppProperties.HealthCheck settings,
            Clock clock,
            Duration stopGrace
    ) {
        this.directory = directory;
        this.prober = prober;
        this.settings = settings;
        this.clock = clock;
        this.stopGrace = stopGrace;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (executor != null) return;
            AtomicBoolean stopped = new AtomicBoolean();
            stopSignal = stopped;
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "provider-health-monitor");
                t.setDaemon(true);
                return t;
            });
            executor.scheduleWithFixedDelay(() -> runScan(stopped), 0, intervalNanos(), TimeUnit.NANOSECONDS);
        }
        log.info("Provider health monitor started interval={} timeout={} maxConsecutiveFailures={}",
                settings.interval(), settings.timeout(), settings.maxConsecutiveFailures());
    }

    /**
     * Stops scheduling, lets the probe in flight finish and waits for the current scan to return.
     */
    @Override
    public void stop() {
        ScheduledExecutorService current;
        synchronized (lifecycleLock) {
            current = executor;
            executor = null;
            stopSignal.set(true);
        }
        if (current == null) return;

        current.shutdown();
        long waitMillis = settings.timeout().plus(stopGrace).toMillis();
        try {
            if (!current.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Provider health scan did not finish within {}ms, interrupting", waitMillis);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Provider health monitor stopped");
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null;
        }
    }

    /**
     * Runs one scan over the providers due at call time.
     */
    public void checkProviders() {
        scan(stopSignal);
    }

    private void scan(AtomicBoolean stopped) {
        Instant now = clock.instant();
        List<ProviderHealthRecord> due;
        try {
            due = directory.listDueForHealthCheck(now);
        } catch (RuntimeException e) {
            log.error("Error listing providers for health check", e);
            return;
        }

        log.debug("Health scan found {} due provider(s)", due.size());
        for (int i = 0; i < due.size(); i++) {
            if (stopped.get()) {
                log.info("Health scan interrupted by shutdown, {} provider(s) left unchecked", due.size() - i);
                return;
            }
            checkProvider(due.get(i));
        }
    }

    void checkProvider(ProviderHealthRecord provider) {
        MDC.put(MDC_KEY, String.valueOf(provider.id()));
        try {
            boolean healthy = prober.probe(provider.endpoint(), settings.timeout());

            HealthStatus newStatus = HealthStatus.READY;
            int consecutiveFailures = 0;
            if (!healthy) {
                consecutiveFailures = provider.consecutiveFailures() + 1;
                newStatus = consecutiveFailures >= settings.maxConsecutiveFailures()
                        ? HealthStatus.NOT_READY
                        : provider.healthStatus();
            }

            Instant nextCheck = BackoffCalculator.nextCheckTime(clock.instant(), newStatus, consecutiveFailures, settings);
            try {
                directory.updateHealthStatus(provider.id(), newStatus, consecutiveFailures, nextCheck);
            } catch (ProviderNotFoundException e) {
                log.warn("Provider {} was removed during health check, skipping update", provider.name());
                return;
            } catch (RuntimeException e) {
                log.error("Error updating health status for provider {}", provider.name(), e);
                return;
            }

            if (provider.healthStatus() != newStatus) {
                log.info("Provider {} health status changed: {} -> {}", provider.name(), provider.healthStatus(), newStatus);
            }
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private void runScan(AtomicBoolean stopped) {
        // unexpected failures are logged and the next scan runs on schedule
        try {
            scan(stopped);
        } catch (RuntimeException e) {
            log.error("Unexpected error during provider health scan", e);
        }
    }

    private long intervalNanos() {
        try {
            return settings.interval().toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
