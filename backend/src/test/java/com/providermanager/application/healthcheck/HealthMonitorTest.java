/*
 * Copyright (C) 2025 Service Provider Manager
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.providermanager.application.healthcheck;

import com.providermanager.application.ProviderNotFoundException;
import com.providermanager.config.AppProperties;
import com.providermanager.domain.model.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private ProviderDirectory directory;

    @Mock
    private LivenessProber prober;

    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        AppProperties.HealthCheck settings = new AppProperties.HealthCheck(
                Duration.ofSeconds(10),
                TIMEOUT,
                3,
                Duration.ofSeconds(10),
                Duration.ofMinutes(5)
        );
        monitor = new HealthMonitor(directory, prober, settings, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void healthyProviderStaysReadyWithZeroFailures() {
        ProviderHealthRecord provider = provider("p1", HealthStatus.READY, 0);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));
        when(prober.probe("http://p1.local", TIMEOUT)).thenReturn(true);

        monitor.checkProviders();

        verify(directory).updateHealthStatus(provider.id(), HealthStatus.READY, 0, NOW.plusSeconds(10));
    }

    @Test
    void repeatedSuccessesNeverFlipStatus() {
        ProviderHealthRecord provider = provider("p1", HealthStatus.READY, 0);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));
        when(prober.probe("http://p1.local", TIMEOUT)).thenReturn(true);

        monitor.checkProviders();
        monitor.checkProviders();
        monitor.checkProviders();

        verify(directory, times(3))
                .updateHealthStatus(provider.id(), HealthStatus.READY, 0, NOW.plusSeconds(10));
    }

    @Test
    void failureBelowThresholdKeepsReadyAndSteadyInterval() {
        ProviderHealthRecord provider = provider("p1", HealthStatus.READY, 1);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));
        when(prober.probe("http://p1.local", TIMEOUT)).thenReturn(false);

        monitor.checkProviders();

        verify(directory).updateHealthStatus(provider.id(), HealthStatus.READY, 2, NOW.plusSeconds(10));
    }

    @Test
    void failureReachingThresholdFlipsToNotReadyWithBaseBackoff() {
        ProviderHealthRecord provider = provider("p1", HealthStatus.READY, 2);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));
        when(prober.probe("http://p1.local", TIMEOUT)).thenReturn(false);

        monitor.checkProviders();

        verify(directory).updateHealthStatus(provider.id(), HealthStatus.NOT_READY, 3, NOW.plusSeconds(10));
    }

    @Test
    void furtherFailuresBackOffExponentially() {
        ProviderHealthRecord provider = provider("p1", HealthStatus.NOT_READY, 4);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));
        when(prober.probe("http://p1.local", TIMEOUT)).thenReturn(false);

        monitor.checkProviders();

        verify(directory).updateHealthStatus(provider.id(), HealthStatus.NOT_READY, 5, NOW.plusSeconds(40));
    }

    @Test
    void singleSuccessRecoversNotReadyProviderImmediately() {
        ProviderHealthRecord provider = provider("p1", HealthStatus.NOT_READY, 9);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));
        when(prober.probe("http://p1.local", TIMEOUT)).thenReturn(true);

        monitor.checkProviders();

        verify(directory).updateHealthStatus(provider.id(), HealthStatus.READY, 0, NOW.plusSeconds(10));
    }

    @Test
    void listingFailureAbandonsScan() {
        when(directory.listDueForHealthCheck(NOW)).thenThrow(new DataAccessResourceFailureException("database is locked"));

        monitor.checkProviders();

        verify(directory, never()).updateHealthStatus(any(), any(), anyInt(), any());
        verifyNoMoreInteractions(prober);
    }

    @Test
    void updateFailureForOneProviderDoesNotAbortScan() {
        ProviderHealthRecord deleted = provider("gone", HealthStatus.READY, 0);
        ProviderHealthRecord broken = provider("broken", HealthStatus.READY, 0);
        ProviderHealthRecord healthy = provider("ok", HealthStatus.READY, 0);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(deleted, broken, healthy));
        when(prober.probe(any(), eq(TIMEOUT))).thenReturn(true);
        doThrow(new ProviderNotFoundException(deleted.id()))
                .when(directory).updateHealthStatus(eq(deleted.id()), any(), anyInt(), any());
        doThrow(new DataAccessResourceFailureException("write conflict"))
                .when(directory).updateHealthStatus(eq(broken.id()), any(), anyInt(), any());

        monitor.checkProviders();

        verify(directory).updateHealthStatus(healthy.id(), HealthStatus.READY, 0, NOW.plusSeconds(10));
    }

    @Test
    void providersAreProbedSequentiallyInSnapshotOrder() {
        ProviderHealthRecord first = provider("first", HealthStatus.READY, 0);
        ProviderHealthRecord second = provider("second", HealthStatus.READY, 0);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(first, second));
        when(prober.probe(any(), eq(TIMEOUT))).thenReturn(true);

        monitor.checkProviders();

        InOrder order = inOrder(directory, prober);
        order.verify(directory).listDueForHealthCheck(NOW);
        order.verify(prober).probe("http://first.local", TIMEOUT);
        order.verify(directory).updateHealthStatus(eq(first.id()), any(), anyInt(), any());
        order.verify(prober).probe("http://second.local", TIMEOUT);
        order.verify(directory).updateHealthStatus(eq(second.id()), any(), anyInt(), any());
        order.verifyNoMoreInteractions();
    }

    @Test
    void stoppedMonitorStartsNoNewProbes() {
        monitor.start();
        monitor.stop();

        ProviderHealthRecord provider = provider("late", HealthStatus.READY, 0);
        when(directory.listDueForHealthCheck(NOW)).thenReturn(List.of(provider));

        monitor.checkProviders();

        verifyNoMoreInteractions(prober);
        verify(directory, never()).updateHealthStatus(any(), any(), anyInt(), any());
    }

    private static ProviderHealthRecord provider(String name, HealthStatus status, int failures) {
        return new ProviderHealthRecord(UUID.randomUUID(), name, "http://" + name + ".local", status, failures, null);
    }
}
