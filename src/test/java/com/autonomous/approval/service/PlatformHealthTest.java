package com.autonomous.approval.service;

import com.autonomous.approval.model.Channel;
import com.autonomous.approval.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlatformHealthTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private SlackService slackService;

    @Mock
    private ChannelRegistryService channelRegistry;

    private PlatformHealth health;

    @BeforeEach
    void setUp() {
        health = new PlatformHealth(eventPublisher, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void shouldStartHealthy() {
        assertTrue(health.isHealthy());
        assertNull(health.getLastCheckAt());
    }

    @Test
    void shouldPublishOnlyOnChange() {
        health.recordProbe(true);
        health.recordProbe(true);
        health.recordProbe(false);
        health.recordProbe(false);
        health.recordProbe(true);

        ArgumentCaptor<PlatformHealthChangedEvent> events = ArgumentCaptor.forClass(PlatformHealthChangedEvent.class);
        verify(eventPublisher, times(3)).publishEvent(events.capture());
        assertTrue(events.getAllValues().get(0).isHealthy());
        assertFalse(events.getAllValues().get(1).isHealthy());
        assertTrue(events.getAllValues().get(2).isHealthy());
        assertTrue(health.isHealthy());
    }

    @Test
    void shouldRecoverAfterUnreachable() {
        health.recordProbe(true);
        health.markUnreachable("timeout");

        assertFalse(health.isHealthy());

        health.recordProbe(true);

        assertTrue(health.isHealthy());
        verify(eventPublisher, times(2)).publishEvent(any(PlatformHealthChangedEvent.class));
    }

    @Test
    void shouldStayUnhealthyAfterAuthFailure() {
        health.markAuthFailure("invalid_auth");
        health.recordProbe(true);

        assertFalse(health.isHealthy());
        assertTrue(health.isAuthFailed());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldSkipProbeOnceAuthFailed() {
        HealthMonitorService monitor = new HealthMonitorService(slackService, health, channelRegistry);
        health.markAuthFailure("token_revoked");

        monitor.probe();

        verifyNoInteractions(slackService);
    }

    @Test
    void shouldFeedProbeResultIntoHealth() {
        HealthMonitorService monitor = new HealthMonitorService(slackService, health, channelRegistry);
        when(slackService.probe()).thenReturn(false);

        monitor.probe();

        assertFalse(health.isHealthy());
        assertNotNull(health.getLastCheckAt());
    }

    @Test
    void shouldRetryDeferredArchivalsWhileHealthy() {
        HealthMonitorService monitor = new HealthMonitorService(slackService, health, channelRegistry);
        when(slackService.probe()).thenReturn(true);
        when(channelRegistry.pendingArchivals()).thenReturn(List.of(Channel.builder().id("C1").build()));

        monitor.probe();

        verify(channelRegistry).retryPendingArchivals();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldLeaveRegistryAloneWhenNothingIsDeferred() {
        HealthMonitorService monitor = new HealthMonitorService(slackService, health, channelRegistry);
        when(slackService.probe()).thenReturn(true);
        when(channelRegistry.pendingArchivals()).thenReturn(List.of());

        monitor.probe();

        verify(channelRegistry, never()).retryPendingArchivals();
    }

    @Test
    void shouldNotRetryArchivalsWhileUnreachable() {
        HealthMonitorService monitor = new HealthMonitorService(slackService, health, channelRegistry);
        when(slackService.probe()).thenReturn(false);

        monitor.probe();

        verifyNoInteractions(channelRegistry);
    }
}
