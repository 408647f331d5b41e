package com.autonomous.approval.service;

import org.springframework.context.ApplicationEvent;

public class PlatformHealthChangedEvent extends ApplicationEvent {

    private final boolean healthy;

    public PlatformHealthChangedEvent(Object source, boolean healthy) {
        super(source);
        this.healthy = healthy;
    }

    public boolean isHealthy() {
        return healthy;
    }
}
