package com.autonomous.approval.service;

import com.autonomous.approval.model.Approval;
import com.autonomous.approval.model.ApprovalChoice;
import com.autonomous.approval.model.RiskLevel;
import com.autonomous.approval.model.SlackMessage;
import com.slack.api.model.block.ActionsBlock;
import com.slack.api.model.block.LayoutBlock;
import com.slack.api.model.block.element.ButtonElement;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalMessageBuilderTest {

    private final ApprovalMessageBuilder builder = new ApprovalMessageBuilder();

    private Approval approval(String command) {
        return Approval.builder()
            .id("abc123")
            .sessionId("s1")
            .channelId("C1")
            .command(command)
            .metadata(Map.of("project", "demo"))
            .riskLevel(RiskLevel.HIGH)
            .createdAt(Instant.parse("2026-01-01T10:00:00Z"))
            .build();
    }

    @Test
    void shouldOfferNumberedChoicesInFallbackText() {
        SlackMessage message = builder.approvalRequest(approval("rm -rf /tmp/x"));

        assertTrue(message.getText().contains("rm -rf /tmp/x"));
        assertTrue(message.getText().contains("[1] Yes, proceed\n[2] No, cancel\n[3] Always approve this kind"));
    }

    @Test
    void shouldAttachOneButtonPerChoicePlusNote() {
        SlackMessage message = builder.approvalRequest(approval("ls"));

        ActionsBlock actions = null;
        for (LayoutBlock block : message.getBlocks()) {
            if (block instanceof ActionsBlock) {
                actions = (ActionsBlock) block;
            }
        }
        assertNotNull(actions);
        List<String> actionIds = actions.getElements().stream()
            .map(e -> ((ButtonElement) e).getActionId())
            .collect(Collectors.toList());
        assertEquals(List.of(
            ApprovalChoice.PROCEED.getActionId(),
            ApprovalChoice.CANCEL.getActionId(),
            ApprovalChoice.ALWAYS_APPROVE.getActionId(),
            ApprovalMessageBuilder.ADD_NOTE_ACTION), actionIds);
        actions.getElements().forEach(e -> assertEquals("abc123", ((ButtonElement) e).getValue()));
    }

    @Test
    void shouldDescribeResolutionWithResponder() {
        Approval approval = approval("ls");
        approval.resolve(ApprovalChoice.CANCEL, "U1", Instant.parse("2026-01-01T10:05:00Z"));

        SlackMessage message = builder.resolvedRequest(approval);

        assertTrue(message.getText().contains("*Denied* by <@U1>"));
        assertTrue(message.getText().contains("2026-01-01 10:05:00 UTC"));
    }

    @Test
    void shouldEscapeSlackControlCharacters() {
        assertEquals("a &lt;b&gt; &amp; c", ApprovalMessageBuilder.escape("a <b> & c"));
        assertEquals("", ApprovalMessageBuilder.escape(null));
    }

    @Test
    void shouldFormatWaitingTime() {
        assertEquals("1 minute", ApprovalMessageBuilder.formatDuration(Duration.ofSeconds(90)));
        assertEquals("15 minutes", ApprovalMessageBuilder.formatDuration(Duration.ofMinutes(15)));
        assertEquals("1h 05m", ApprovalMessageBuilder.formatDuration(Duration.ofMinutes(65)));
    }

    @Test
    void shouldCountRemindersInReminderText() {
        Approval approval = approval("ls");
        approval.recordReminder();

        SlackMessage message = builder.reminder(approval, Duration.ofMinutes(15));

        assertTrue(message.getText().contains("after 15 minutes (reminder #1)"));
        assertTrue(message.getText().contains("[2] No, cancel"));
    }
}
