package com.autonomous.approval.service;

import com.autonomous.approval.model.ApprovalSource;
import com.autonomous.approval.model.ApprovalStatus;
import com.autonomous.approval.model.ResolvedApproval;
import com.autonomous.approval.model.RiskLevel;
import com.autonomous.approval.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TerminalFallbackServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private TerminalFallbackService fallback;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        fallback = new TerminalFallbackService(new MutableClock(NOW));
        out = new ByteArrayOutputStream();
    }

    private ResolvedApproval promptWith(String input) {
        fallback.setConsole(new BufferedReader(new StringReader(input)),
            new PrintStream(out, true, StandardCharsets.UTF_8));
        return fallback.prompt("a1", "s1", "rm -rf /tmp/x", RiskLevel.HIGH);
    }

    @Test
    void shouldShowCommandRiskAndChoices() {
        promptWith("1\n");

        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("rm -rf /tmp/x"));
        assertTrue(printed.contains("HIGH"));
        assertTrue(printed.contains("[1] Yes, proceed"));
        assertTrue(printed.contains("[2] No, cancel"));
        assertTrue(printed.contains("[3] Always approve this kind"));
    }

    @Test
    void shouldApproveOnOne() {
        ResolvedApproval result = promptWith("1\n");

        assertEquals(ApprovalStatus.APPROVED, result.getStatus());
        assertEquals(ApprovalSource.TERMINAL, result.getSource());
        assertEquals("a1", result.getApprovalId());
        assertEquals(NOW, result.getRespondedAt());
    }

    @Test
    void shouldCancelWhenPromptIsWithdrawnWhileReading() {
        Thread.currentThread().interrupt();
        ResolvedApproval result;
        try {
            result = promptWith("1\n");
        } finally {
            Thread.interrupted();
        }

        assertEquals(ApprovalStatus.CANCELLED, result.getStatus());
        assertNull(result.getRespondedBy());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Session ended, request withdrawn."));
    }

    @Test
    void shouldRepromptOnInvalidInput() {
        ResolvedApproval result = promptWith("yes\n7\n\n2\n");

        assertEquals(ApprovalStatus.DENIED, result.getStatus());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Please enter 1, 2 or 3."));
    }

    @Test
    void shouldRecordAlwaysApprove() {
        assertEquals(ApprovalStatus.ALWAYS_APPROVE, promptWith(" 3 \n").getStatus());
    }

    @Test
    void shouldCancelWhenInputCloses() {
        ResolvedApproval result = promptWith("maybe\n");

        assertEquals(ApprovalStatus.CANCELLED, result.getStatus());
        assertFalse(result.isApproved());
        assertNull(result.getRespondedBy());
    }
}
