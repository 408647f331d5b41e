package com.autonomous.approval.service;

import com.autonomous.approval.exception.ApprovalNotFoundException;
import com.autonomous.approval.exception.PlatformException;
import com.autonomous.approval.exception.PlatformUnavailableException;
import com.autonomous.approval.model.Approval;
import com.autonomous.approval.model.ApprovalSource;
import com.autonomous.approval.model.ApprovalStatus;
import com.autonomous.approval.model.ApprovalTicket;
import com.autonomous.approval.model.ResolvedApproval;
import com.autonomous.approval.model.RiskLevel;
import com.autonomous.approval.model.SessionClosure;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point for the automation agent. Routes each request to Slack when it is
 * healthy and to the local console otherwise, and closes sessions.
 */
@Slf4j
@Service
public class ApprovalCoordinator {

    @Value("${approval.fallback.terminal-enabled:true}")
    private boolean terminalEnabled = true;

    private final ApprovalLedgerService ledger;
    private final ChannelRegistryService channelRegistry;
    private final TerminalFallbackService terminalFallback;
    private final RiskAssessorService riskAssessor;
    private final ApprovalNotifier notifier;
    private final PlatformHealth platformHealth;
    private final Clock clock;

    private final ExecutorService terminalExecutor = Executors.newSingleThreadExecutor();
    private final Map<String, TerminalRequest> terminalRequests = new ConcurrentHashMap<>();

    public ApprovalCoordinator(ApprovalLedgerService ledger, ChannelRegistryService channelRegistry,
                               TerminalFallbackService terminalFallback, RiskAssessorService riskAssessor,
                               ApprovalNotifier notifier, PlatformHealth platformHealth, Clock clock) {
        this.ledger = ledger;
        this.channelRegistry = channelRegistry;
        this.terminalFallback = terminalFallback;
        this.riskAssessor = riskAssessor;
        this.notifier = notifier;
        this.platformHealth = platformHealth;
        this.clock = clock;
    }

    public void setTerminalEnabled(boolean terminalEnabled) {
        this.terminalEnabled = terminalEnabled;
    }

    public CompletableFuture<ResolvedApproval> requestApproval(String sessionId, String command,
                                                               Map<String, String> metadata) {
        return submit(sessionId, command, metadata).getResolution();
    }

    /**
     * Submits a command for approval.
     *
     * @throws PlatformUnavailableException when Slack is unavailable and the terminal
     *                                      fallback is disabled
     */
    public ApprovalTicket submit(String sessionId, String command, Map<String, String> metadata) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        if (platformHealth.isHealthy()) {
            try {
                Approval approval = ledger.requestApproval(sessionId, command, metadata);
                return new ApprovalTicket(approval.getId(), approval.getChannelId(), ApprovalSource.SLACK,
                    ledger.awaitResolution(approval.getId()));
            } catch (PlatformUnavailableException e) {
                log.warn("[Coordinator] Slack unavailable for session {}: {}", sessionId, e.getMessage());
            } catch (PlatformException e) {
                if (platformHealth.isHealthy()) {
                    throw e;
                }
                log.warn("[Coordinator] Slack became unhealthy for session {}: {}", sessionId, e.getMessage());
            }
        }
        return submitToTerminal(sessionId, command, metadata);
    }

    /**
     * Cancels what is still pending in the session, on Slack and on the console, and
     * archives its channel. Calling it again is harmless.
     */
    public SessionClosure endSession(String sessionId) {
        int cancelled = ledger.cancelForSession(sessionId) + cancelTerminalRequests(sessionId);
        boolean archived = channelRegistry.archiveBySession(sessionId);
        log.info("[Coordinator] Session {} ended: {} approvals cancelled, channel archived: {}",
            sessionId, cancelled, archived);
        return SessionClosure.builder()
            .sessionId(sessionId)
            .cancelledApprovals(cancelled)
            .channelArchived(archived)
            .build();
    }

    public void registerCallback(String approvalId, String callbackUrl) {
        if (ledger.find(approvalId).isEmpty() && !terminalRequests.containsKey(approvalId)) {
            throw new ApprovalNotFoundException(approvalId);
        }
        validateCallbackUrl(callbackUrl);
        notifier.registerCallback(approvalId, callbackUrl);
        log.info("[Coordinator] Callback {} registered for approval {}", callbackUrl, approvalId);
    }

    /** Current view of an approval, from whichever path is serving it. */
    public ResolvedApproval status(String approvalId) {
        Optional<Approval> approval = ledger.find(approvalId);
        if (approval.isPresent()) {
            return ledger.toResolved(approval.get());
        }
        TerminalRequest request = terminalRequests.get(approvalId);
        if (request == null) {
            throw new ApprovalNotFoundException(approvalId);
        }
        ResolvedApproval done = request.future.getNow(null);
        if (done != null) {
            return done;
        }
        return ResolvedApproval.builder()
            .approvalId(approvalId)
            .sessionId(request.sessionId)
            .command(request.command)
            .status(ApprovalStatus.PENDING)
            .source(ApprovalSource.TERMINAL)
            .build();
    }

    private ApprovalTicket submitToTerminal(String sessionId, String command, Map<String, String> metadata) {
        if (!terminalEnabled) {
            throw new PlatformUnavailableException("approval",
                "Slack is unavailable and the terminal fallback is disabled");
        }
        String approvalId = Approval.newId();
        RiskLevel risk = riskAssessor.assess(command, metadata);
        TerminalRequest request = new TerminalRequest(sessionId, command);
        terminalRequests.put(approvalId, request);
        request.task = terminalExecutor.submit(() -> {
            try {
                settle(request, terminalFallback.prompt(approvalId, sessionId, command, risk));
            } catch (RuntimeException e) {
                log.error("[Coordinator] Console prompt failed for approval {} (session {})", approvalId, sessionId, e);
                request.future.completeExceptionally(e);
            }
        });
        return new ApprovalTicket(approvalId, null, ApprovalSource.TERMINAL, request.future);
    }

    private int cancelTerminalRequests(String sessionId) {
        int cancelled = 0;
        for (Map.Entry<String, TerminalRequest> entry : terminalRequests.entrySet()) {
            TerminalRequest request = entry.getValue();
            if (!sessionId.equals(request.sessionId)) {
                continue;
            }
            ResolvedApproval withdrawn = ResolvedApproval.builder()
                .approvalId(entry.getKey())
                .sessionId(sessionId)
                .command(request.command)
                .status(ApprovalStatus.CANCELLED)
                .respondedAt(clock.instant())
                .source(ApprovalSource.TERMINAL)
                .build();
            if (settle(request, withdrawn)) {
                cancelled++;
                Future<?> task = request.task;
                if (task != null) {
                    task.cancel(true);
                }
            }
        }
        return cancelled;
    }

    /** Completes the request once; a later outcome is dropped. */
    private boolean settle(TerminalRequest request, ResolvedApproval resolved) {
        synchronized (request) {
            if (request.future.isDone()) {
                log.info("[Coordinator] Discarding late {} for approval {} (session {})",
                    resolved.getStatus().getValue(), resolved.getApprovalId(), resolved.getSessionId());
                return false;
            }
            notifier.notifyResolved(resolved);
            request.future.complete(resolved);
            return true;
        }
    }

    private static void validateCallbackUrl(String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            throw new IllegalArgumentException("callbackUrl is required");
        }
        String scheme;
        try {
            scheme = URI.create(callbackUrl).getScheme();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid callbackUrl: " + callbackUrl, e);
        }
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("callbackUrl must be http or https: " + callbackUrl);
        }
    }

    @PreDestroy
    public void shutdown() {
        terminalExecutor.shutdownNow();
    }

    private static final class TerminalRequest {
        private final String sessionId;
        private final String command;
        private final CompletableFuture<ResolvedApproval> future = new CompletableFuture<>();
        private volatile Future<?> task;

        private TerminalRequest(String sessionId, String command) {
            this.sessionId = sessionId;
            this.command = command;
        }
    }
}
