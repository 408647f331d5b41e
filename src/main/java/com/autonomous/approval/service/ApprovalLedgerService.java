package com.autonomous.approval.service;

import com.autonomous.approval.exception.AlreadyResolvedException;
import com.autonomous.approval.exception.ApprovalNotFoundException;
import com.autonomous.approval.exception.PlatformException;
import com.autonomous.approval.exception.PlatformUnavailableException;
import com.autonomous.approval.model.Approval;
import com.autonomous.approval.model.ApprovalChoice;
import com.autonomous.approval.model.ApprovalSource;
import com.autonomous.approval.model.Channel;
import com.autonomous.approval.model.ResolvedApproval;
import com.autonomous.approval.model.RiskLevel;
import com.autonomous.approval.model.SlackMessage;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns approvals and their reminders.
 *
 * <p>An approval is created {@code pending}, posted to the session channel and
 * reminded about every interval until a human answers or the session ends. Time
 * alone never resolves it. Each approval has at most one live reminder, and the
 * reminder is cancelled as soon as the approval leaves {@code pending}.
 */
@Slf4j
@Service
public class ApprovalLedgerService {

    public static final String META_PROJECT = "project";
    public static final String META_SUB_SESSION = "subSessionId";

    @Value("${approval.reminder.interval-minutes:15}")
    private long reminderIntervalMinutes = 15;

    private final ApprovalRepository repository;
    private final ChannelRegistryService channelRegistry;
    private final SlackService slackService;
    private final ApprovalMessageBuilder messageBuilder;
    private final ReminderScheduler reminderScheduler;
    private final RiskAssessorService riskAssessor;
    private final ApprovalNotifier notifier;
    private final PlatformHealth platformHealth;
    private final Clock clock;

    private final Map<String, ReminderHandle> reminders = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ResolvedApproval>> resolutions = new ConcurrentHashMap<>();

    public ApprovalLedgerService(ApprovalRepository repository, ChannelRegistryService channelRegistry,
                                 SlackService slackService, ApprovalMessageBuilder messageBuilder,
                                 ReminderScheduler reminderScheduler, RiskAssessorService riskAssessor,
                                 ApprovalNotifier notifier, PlatformHealth platformHealth, Clock clock) {
        this.repository = repository;
        this.channelRegistry = channelRegistry;
        this.slackService = slackService;
        this.messageBuilder = messageBuilder;
        this.reminderScheduler = reminderScheduler;
        this.riskAssessor = riskAssessor;
        this.notifier = notifier;
        this.platformHealth = platformHealth;
        this.clock = clock;
    }

    public void setReminderIntervalMinutes(long reminderIntervalMinutes) {
        this.reminderIntervalMinutes = reminderIntervalMinutes;
    }

    public Duration getReminderInterval() {
        return Duration.ofMinutes(reminderIntervalMinutes);
    }

    /**
     * Opens an approval in the session channel. If the request message cannot be
     * posted the approval still exists and the first reminder re-attempts the post.
     *
     * @throws PlatformUnavailableException when Slack is unhealthy
     */
    public Approval requestApproval(String sessionId, String command, Map<String, String> metadata) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        if (!platformHealth.isHealthy()) {
            throw new PlatformUnavailableException("chat.postMessage", "Slack is unavailable");
        }
        Map<String, String> meta = metadata != null ? metadata : Map.of();
        String subSessionId = meta.get(META_SUB_SESSION);
        Channel channel = channelRegistry.resolveOrCreateChannel(sessionId, subSessionId,
            channelNameParts(sessionId, subSessionId, meta), meta);
        RiskLevel risk = riskAssessor.assess(command, meta);

        Approval approval = Approval.builder()
            .id(Approval.newId())
            .sessionId(sessionId)
            .channelId(channel.getId())
            .command(command)
            .metadata(meta)
            .riskLevel(risk)
            .createdAt(clock.instant())
            .build();
        repository.save(approval);
        resolutions.put(approval.getId(), new CompletableFuture<>());
        log.info("[Approval] {} opened for session {} in {} (risk {}): {}",
            approval.getId(), sessionId, channel.getId(), risk.getValue(), command);

        postRequest(approval);
        scheduleReminder(approval);
        return approval;
    }

    /**
     * Applies a human answer.
     *
     * @throws ApprovalNotFoundException for an unknown id
     * @throws AlreadyResolvedException  when the approval already left {@code pending}
     */
    public ResolvedApproval resolve(String approvalId, ApprovalChoice choice, String responderId) {
        Approval approval = repository.findById(approvalId)
            .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
        approval.resolve(choice, responderId, clock.instant());
        cancelReminder(approvalId);
        log.info("[Approval] {} (session {}) {} by {}",
            approvalId, approval.getSessionId(), approval.getStatus().getValue(), responderId);

        if (responderId != null && platformHealth.isHealthy()) {
            slackService.lookupDisplayName(responderId).ifPresent(approval::recordResponderName);
        }
        updateRequestMessage(approval);
        ResolvedApproval resolved = toResolved(approval);
        if (resolved.isApproved()) {
            postInThread(approval, messageBuilder.executing(approval));
        }
        complete(resolved);
        return resolved;
    }

    /**
     * Cancels every pending approval of a session. Resolved approvals are left alone.
     *
     * @return the number of approvals cancelled
     */
    public int cancelForSession(String sessionId) {
        int cancelled = 0;
        Instant now = clock.instant();
        for (Approval approval : repository.findBySession(sessionId)) {
            if (!approval.cancel(now)) {
                continue;
            }
            cancelReminder(approval.getId());
            updateRequestMessage(approval);
            complete(toResolved(approval));
            cancelled++;
        }
        if (cancelled > 0) {
            log.info("[Approval] Cancelled {} pending approvals of session {}", cancelled, sessionId);
        }
        return cancelled;
    }

    /**
     * Runs when a reminder fires. A non-pending approval ends the reminder chain; a
     * pending one is always rescheduled, even when posting the reminder failed.
     */
    public void fireReminder(String approvalId) {
        Optional<Approval> found = repository.findById(approvalId);
        if (found.isEmpty() || !found.get().isPending()) {
            reminders.remove(approvalId);
            return;
        }
        Approval approval = found.get();
        try {
            int count = approval.recordReminder();
            Duration waited = Duration.between(approval.getCreatedAt(), clock.instant());
            log.info("[Approval] Reminder #{} for {} (session {}), waiting {}",
                count, approvalId, approval.getSessionId(), waited);

            if (!platformHealth.isHealthy()) {
                log.warn("[Approval] Slack unavailable, reminder #{} for {} not posted", count, approvalId);
            } else {
                if (approval.getMessageTs() == null) {
                    postRequest(approval);
                }
                postInThread(approval, messageBuilder.reminder(approval, waited));
            }
        } finally {
            scheduleReminder(approval);
        }
    }

    public CompletableFuture<ResolvedApproval> awaitResolution(String approvalId) {
        Approval approval = repository.findById(approvalId)
            .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
        CompletableFuture<ResolvedApproval> future =
            resolutions.computeIfAbsent(approvalId, id -> new CompletableFuture<>());
        if (!approval.isPending()) {
            future.complete(toResolved(approval));
        }
        return future.copy();
    }

    public Optional<Approval> find(String approvalId) {
        return repository.findById(approvalId);
    }

    public Optional<Approval> findByMessage(String channelId, String messageTs) {
        return repository.findByMessage(channelId, messageTs);
    }

    public List<Approval> getPendingForSession(String sessionId) {
        return repository.findBySession(sessionId).stream()
            .filter(Approval::isPending)
            .collect(Collectors.toList());
    }

    public List<Approval> getAllPending() {
        return repository.findPending();
    }

    public boolean hasLiveReminder(String approvalId) {
        ReminderHandle handle = reminders.get(approvalId);
        return handle != null && !handle.isCancelled();
    }

    public ResolvedApproval toResolved(Approval approval) {
        return ResolvedApproval.builder()
            .approvalId(approval.getId())
            .sessionId(approval.getSessionId())
            .channelId(approval.getChannelId())
            .command(approval.getCommand())
            .status(approval.getStatus())
            .respondedBy(approval.getRespondedBy())
            .respondedByName(approval.getRespondedByName())
            .respondedAt(approval.getRespondedAt())
            .source(ApprovalSource.SLACK)
            .build();
    }

    @PreDestroy
    public void cancelAllReminders() {
        new ArrayList<>(reminders.keySet()).forEach(this::cancelReminder);
    }

    private void scheduleReminder(Approval approval) {
        Instant at = clock.instant().plus(getReminderInterval());
        reminders.compute(approval.getId(), (id, existing) -> {
            if (existing != null) {
                existing.cancel();
            }
            if (!approval.isPending()) {
                return null;
            }
            return reminderScheduler.schedule(() -> fireReminder(id), at);
        });
    }

    private void cancelReminder(String approvalId) {
        ReminderHandle handle = reminders.remove(approvalId);
        if (handle != null) {
            handle.cancel();
        }
    }

    private void complete(ResolvedApproval resolved) {
        resolutions.computeIfAbsent(resolved.getApprovalId(), id -> new CompletableFuture<>()).complete(resolved);
        notifier.notifyResolved(resolved);
    }

    private void postRequest(Approval approval) {
        try {
            String ts = slackService.postMessage(approval.getChannelId(), messageBuilder.approvalRequest(approval));
            approval.attachMessage(ts);
        } catch (PlatformException e) {
            log.warn("[Approval] Could not post approval {} (session {}), the next reminder retries: {}",
                approval.getId(), approval.getSessionId(), e.getMessage());
        }
    }

    private void updateRequestMessage(Approval approval) {
        if (approval.getMessageTs() == null || !platformHealth.isHealthy()) {
            return;
        }
        try {
            slackService.updateMessage(approval.getChannelId(), approval.getMessageTs(),
                messageBuilder.resolvedRequest(approval));
        } catch (PlatformException e) {
            log.warn("[Approval] Could not update message of approval {} (session {}): {}",
                approval.getId(), approval.getSessionId(), e.getMessage());
        }
    }

    private void postInThread(Approval approval, SlackMessage message) {
        if (approval.getMessageTs() == null || !platformHealth.isHealthy()) {
            return;
        }
        try {
            slackService.postThreadReply(approval.getChannelId(), approval.getMessageTs(), message);
        } catch (PlatformException e) {
            log.warn("[Approval] Thread reply failed for approval {} (session {}): {}",
                approval.getId(), approval.getSessionId(), e.getMessage());
        }
    }

    private static List<String> channelNameParts(String sessionId, String subSessionId, Map<String, String> meta) {
        List<String> parts = new ArrayList<>();
        String project = meta.get(META_PROJECT);
        if (project != null) {
            parts.add(project);
        }
        parts.add(sessionId);
        if (subSessionId != null) {
            parts.add(subSessionId);
        }
        return parts;
    }
}
