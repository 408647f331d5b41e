package com.autonomous.approval.service;

import com.autonomous.approval.model.ApprovalChoice;
import com.autonomous.approval.model.ApprovalSource;
import com.autonomous.approval.model.ApprovalStatus;
import com.autonomous.approval.model.ResolvedApproval;
import com.autonomous.approval.model.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;

/**
 * Asks on the local console when Slack cannot be used. Blocks until a valid
 * choice is typed. Closed input cancels; it never approves or denies by default.
 */
@Slf4j
@Service
public class TerminalFallbackService {

    private final Clock clock;

    private BufferedReader input;
    private PrintStream output;

    public TerminalFallbackService(Clock clock) {
        this.clock = clock;
        this.input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        this.output = System.out;
    }

    public synchronized void setConsole(BufferedReader input, PrintStream output) {
        this.input = input;
        this.output = output;
    }

    public synchronized ResolvedApproval prompt(String approvalId, String sessionId, String command, RiskLevel risk) {
        log.warn("[Terminal] Slack unavailable, asking on the console for approval {} (session {})",
            approvalId, sessionId);
        output.println();
        output.println("=== Approval required (Slack unavailable) ===");
        output.println("Session: " + sessionId);
        output.println("Command: " + command);
        output.println("Risk:    " + risk.getValue().toUpperCase());
        for (ApprovalChoice choice : ApprovalChoice.values()) {
            output.println(choice.toOptionText());
        }

        ResolvedApproval.ResolvedApprovalBuilder result = ResolvedApproval.builder()
            .approvalId(approvalId)
            .sessionId(sessionId)
            .command(command)
            .source(ApprovalSource.TERMINAL);
        while (true) {
            output.print("Choice [1-3]: ");
            output.flush();
            String line;
            try {
                line = input.readLine();
            } catch (IOException e) {
                log.error("[Terminal] Console read failed for approval {}, cancelling", approvalId, e);
                line = null;
            }
            if (Thread.currentThread().isInterrupted()) {
                output.println();
                output.println("Session ended, request withdrawn.");
                log.info("[Terminal] Prompt for approval {} (session {}) withdrawn", approvalId, sessionId);
                return result.status(ApprovalStatus.CANCELLED).respondedAt(clock.instant()).build();
            }
            if (line == null) {
                output.println();
                output.println("Input closed, request cancelled.");
                log.warn("[Terminal] Console closed, approval {} (session {}) cancelled", approvalId, sessionId);
                return result.status(ApprovalStatus.CANCELLED).respondedAt(clock.instant()).build();
            }
            Optional<ApprovalChoice> choice = ApprovalChoice.fromText(line);
            if (choice.isPresent()) {
                String user = System.getProperty("user.name");
                log.info("[Terminal] Approval {} (session {}) answered {} on the console",
                    approvalId, sessionId, choice.get().getStatus().getValue());
                return result.status(choice.get().getStatus())
                    .respondedBy(user)
                    .respondedByName(user)
                    .respondedAt(clock.instant())
                    .build();
            }
            output.println("Please enter 1, 2 or 3.");
        }
    }
}
