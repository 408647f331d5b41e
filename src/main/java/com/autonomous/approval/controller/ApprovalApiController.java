package com.autonomous.approval.controller;

import com.autonomous.approval.model.ApprovalSource;
import com.autonomous.approval.model.ApprovalSubmission;
import com.autonomous.approval.model.ApprovalTicket;
import com.autonomous.approval.model.CallbackRegistration;
import com.autonomous.approval.model.ResolvedApproval;
import com.autonomous.approval.service.ApprovalCoordinator;
import com.autonomous.approval.service.ApprovalLedgerService;
import com.autonomous.approval.service.PlatformHealth;
import com.autonomous.approval.service.PlatformRateLimiter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Local HTTP surface for the automation agent and for operators.
 */
@RestController
public class ApprovalApiController {

    @Autowired
    private ApprovalCoordinator coordinator;

    @Autowired
    private ApprovalLedgerService ledger;

    @Autowired
    private PlatformHealth platformHealth;

    @Autowired
    private PlatformRateLimiter rateLimiter;

    @Autowired
    private Clock clock;

    @PostMapping("/api/approvals")
    public ResponseEntity<ResolvedApproval> submit(@RequestBody ApprovalSubmission submission) {
        ApprovalTicket ticket = coordinator.submit(
            submission.getSessionId(), submission.getCommand(), submission.getMetadata());
        if (ticket.getSource() == ApprovalSource.TERMINAL) {
            return ResponseEntity.ok(ticket.getResolution().join());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.status(ticket.getApprovalId()));
    }

    @GetMapping("/api/approvals/{approvalId}")
    public ResponseEntity<ResolvedApproval> get(@PathVariable String approvalId) {
        return ResponseEntity.ok(coordinator.status(approvalId));
    }

    @GetMapping("/api/pending-approvals")
    public ResponseEntity<List<ResolvedApproval>> pending() {
        return ResponseEntity.ok(ledger.getAllPending().stream()
            .map(ledger::toResolved)
            .collect(Collectors.toList()));
    }

    @PostMapping("/api/register-callback")
    public ResponseEntity<?> registerCallback(@RequestBody CallbackRegistration registration) {
        coordinator.registerCallback(registration.getApprovalId(), registration.getCallbackUrl());
        return ResponseEntity.ok(Map.of("registered", true, "approvalId", registration.getApprovalId()));
    }

    @PostMapping("/api/sessions/{sessionId}/end")
    public ResponseEntity<?> endSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(coordinator.endSession(sessionId));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", platformHealth.isHealthy() ? "healthy" : "degraded");
        body.put("slack", platformHealth.isHealthy());
        body.put("rateLimitDelayMs", rateLimiter.getCurrentDelayMs());
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(body);
    }
}
