package com.autonomous.approval.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Shared view of whether Slack can be reached. Every component checks
 * {@link #isHealthy()} before calling out and degrades otherwise.
 */
@Slf4j
@Component
public class PlatformHealth {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private volatile boolean healthy = true;
    private volatile boolean authFailed;
    private volatile Boolean lastProbeResult;
    private volatile Instant lastCheckAt;

    public PlatformHealth(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean isHealthy() {
        return healthy && !authFailed;
    }

    public boolean isAuthFailed() {
        return authFailed;
    }

    public Instant getLastCheckAt() {
        return lastCheckAt;
    }

    /**
     * Records a liveness probe result. Publishes a {@link PlatformHealthChangedEvent}
     * on the first probe and on every change afterwards.
     */
    public void recordProbe(boolean ok) {
        lastCheckAt = clock.instant();
        if (authFailed) {
            return;
        }
        Boolean previous = lastProbeResult;
        lastProbeResult = ok;
        healthy = ok;
        if (previous == null || previous != ok) {
            if (ok) {
                log.info("[Health] Slack is reachable");
            } else {
                log.warn("[Health] Slack health check failed, approvals fall back to the terminal");
            }
            eventPublisher.publishEvent(new PlatformHealthChangedEvent(this, ok));
        }
    }

    public void markUnreachable(String reason) {
        if (healthy) {
            log.warn("[Health] Marking Slack unreachable: {}", reason);
        }
        healthy = false;
        lastProbeResult = false;
    }

    public void markAuthFailure(String errorCode) {
        if (!authFailed) {
            log.error("[Health] Slack authentication error ({}), check slack.bot.token; restart required", errorCode);
        }
        authFailed = true;
        healthy = false;
    }
}
