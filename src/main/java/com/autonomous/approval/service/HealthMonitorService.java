package com.autonomous.approval.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class HealthMonitorService {

    private final SlackService slackService;
    private final PlatformHealth platformHealth;
    private final ChannelRegistryService channelRegistry;

    public HealthMonitorService(SlackService slackService, PlatformHealth platformHealth,
                                ChannelRegistryService channelRegistry) {
        this.slackService = slackService;
        this.platformHealth = platformHealth;
        this.channelRegistry = channelRegistry;
    }

    @Scheduled(fixedDelayString = "${approval.health.interval-ms:30000}",
               initialDelayString = "${approval.health.initial-delay-ms:0}")
    public void probe() {
        if (platformHealth.isAuthFailed()) {
            log.debug("[Health] Skipping probe, authentication error needs operator attention");
            return;
        }
        platformHealth.recordProbe(slackService.probe());

        // archivals deferred by a plain Slack error never see a health transition
        if (platformHealth.isHealthy() && !channelRegistry.pendingArchivals().isEmpty()) {
            channelRegistry.retryPendingArchivals();
        }
    }
}
