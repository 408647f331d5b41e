package com.autonomous.approval.model;

import com.autonomous.approval.exception.AlreadyResolvedException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single authorization request for one command.
 *
 * <p>The approval is its own state machine: the only outgoing transitions are
 * from {@link ApprovalStatus#PENDING}, and they are applied under the approval's
 * monitor so that a webhook response and a session cancellation racing each
 * other cannot both win.
 */
@Getter
public class Approval {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String id;
    private final String sessionId;
    private final String channelId;
    private final String command;
    private final Map<String, String> metadata;
    private final RiskLevel riskLevel;
    private final Instant createdAt;

    private volatile ApprovalStatus status = ApprovalStatus.PENDING;
    private volatile Instant respondedAt;
    private volatile String respondedBy;
    private volatile String respondedByName;
    private volatile String messageTs;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger reminderCount = new AtomicInteger();

    @Builder
    public Approval(String id, String sessionId, String channelId, String command,
                    Map<String, String> metadata, RiskLevel riskLevel, Instant createdAt) {
        this.id = id;
        this.sessionId = sessionId;
        this.channelId = channelId;
        this.command = command;
        this.metadata = metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.riskLevel = riskLevel == null ? RiskLevel.MEDIUM : riskLevel;
        this.createdAt = createdAt;
    }

    public static String newId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public int getReminderCount() {
        return reminderCount.get();
    }

    @JsonIgnore
    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    /**
     * Applies a human response.
     *
     * @throws AlreadyResolvedException if the approval already left {@code pending}
     */
    public synchronized void resolve(ApprovalChoice choice, String responderId, Instant at) {
        transitionTo(choice.getStatus());
        this.respondedBy = responderId;
        this.respondedAt = at;
    }

    /**
     * Cancels a pending approval.
     *
     * @return {@code false} when the approval was already terminal
     */
    public synchronized boolean cancel(Instant at) {
        if (!status.canTransitionTo(ApprovalStatus.CANCELLED)) {
            return false;
        }
        this.status = ApprovalStatus.CANCELLED;
        this.respondedAt = at;
        return true;
    }

    public void attachMessage(String messageTs) {
        this.messageTs = messageTs;
    }

    public void recordResponderName(String name) {
        this.respondedByName = name;
    }

    public int recordReminder() {
        return reminderCount.incrementAndGet();
    }

    private void transitionTo(ApprovalStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new AlreadyResolvedException(id, status);
        }
        this.status = target;
    }
}
