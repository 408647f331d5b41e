package com.autonomous.approval.service;

import com.autonomous.approval.model.Approval;
import com.autonomous.approval.model.ApprovalChoice;
import com.autonomous.approval.model.ApprovalStatus;
import com.autonomous.approval.model.Channel;
import com.autonomous.approval.model.SlackMessage;
import com.slack.api.model.block.ActionsBlock;
import com.slack.api.model.block.ContextBlock;
import com.slack.api.model.block.ContextBlockElement;
import com.slack.api.model.block.DividerBlock;
import com.slack.api.model.block.HeaderBlock;
import com.slack.api.model.block.LayoutBlock;
import com.slack.api.model.block.SectionBlock;
import com.slack.api.model.block.composition.MarkdownTextObject;
import com.slack.api.model.block.composition.PlainTextObject;
import com.slack.api.model.block.element.BlockElement;
import com.slack.api.model.block.element.ButtonElement;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders every message the gateway posts to Slack.
 */
@Component
public class ApprovalMessageBuilder {

    public static final String ADD_NOTE_ACTION = "add_note";

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    /**
     * The approval request: command, risk, the numbered choices and one button per
     * choice. The fallback text carries the numbered choices too, so clients without
     * Block Kit still show what to answer.
     */
    public SlackMessage approvalRequest(Approval approval) {
        String options = numberedOptions();
        List<LayoutBlock> blocks = new ArrayList<>();
        blocks.add(header(":lock: Approval required"));
        blocks.add(section(String.format("*Command:*\n```%s```", escape(approval.getCommand()))));
        blocks.add(section(String.format("*Risk:* %s %s", approval.getRiskLevel().getEmoji(),
            approval.getRiskLevel().getValue().toUpperCase())));

        String details = metadataLines(approval.getMetadata());
        if (!details.isEmpty()) {
            blocks.add(section(details));
        }

        blocks.add(section(options + "\n_Click a button or reply in the thread with 1, 2 or 3._"));
        blocks.add(ActionsBlock.builder()
            .blockId("approval_" + approval.getId())
            .elements(buttons(approval.getId()))
            .build());
        blocks.add(context(String.format("Approval `%s` · session `%s` · requested %s",
            approval.getId(), escape(approval.getSessionId()), TIME_FORMAT.format(approval.getCreatedAt()))));

        String text = String.format("Approval required for `%s` (risk: %s)\n%s",
            approval.getCommand(), approval.getRiskLevel().getValue(), options);
        return SlackMessage.builder().text(text).blocks(blocks).build();
    }

    /** The request message after it left {@code pending}; buttons are removed. */
    public SlackMessage resolvedRequest(Approval approval) {
        String outcome = outcomeLine(approval);
        List<LayoutBlock> blocks = new ArrayList<>();
        blocks.add(section(String.format("*Command:*\n```%s```", escape(approval.getCommand()))));
        blocks.add(section(outcome));
        blocks.add(context(String.format("Approval `%s` · session `%s`",
            approval.getId(), escape(approval.getSessionId()))));
        return SlackMessage.builder()
            .text(outcome + ": " + approval.getCommand())
            .blocks(blocks)
            .build();
    }

    public SlackMessage reminder(Approval approval, Duration waited) {
        String text = String.format(":alarm_clock: Still waiting for a response after %s (reminder #%d).\n%s",
            formatDuration(waited), approval.getReminderCount(), numberedOptions());
        return SlackMessage.builder().text(text).blocks(List.of(section(text))).build();
    }

    public SlackMessage executing(Approval approval) {
        String text = String.format(":gear: Command is being executed: `%s`", escape(approval.getCommand()));
        return SlackMessage.builder().text(text).blocks(List.of(section(text))).build();
    }

    public SlackMessage welcome(Channel channel, Map<String, String> context) {
        StringBuilder body = new StringBuilder();
        body.append("*Session:* `").append(escape(channel.getSessionId())).append("`\n");
        if (channel.getSubSessionId() != null) {
            body.append("*Sub-session:* `").append(escape(channel.getSubSessionId())).append("`\n");
        }
        String project = context.get("project");
        if (project != null && !project.isBlank()) {
            body.append("*Project:* ").append(escape(project)).append("\n");
        }
        body.append("*Created:* ").append(TIME_FORMAT.format(channel.getCreatedAt()));

        List<LayoutBlock> blocks = new ArrayList<>();
        blocks.add(header(":wave: Command approvals for this session"));
        blocks.add(section(body.toString()));
        blocks.add(DividerBlock.builder().build());
        blocks.add(context("Commands that need a human decision are posted here."));
        return SlackMessage.builder()
            .text("Command approvals for session " + channel.getSessionId())
            .blocks(blocks)
            .build();
    }

    public SlackMessage closing(Channel channel, Instant closedAt) {
        String text = String.format(":checkered_flag: Session `%s` ended at %s. This channel is being archived.",
            escape(channel.getSessionId()), TIME_FORMAT.format(closedAt));
        return SlackMessage.builder().text(text).blocks(List.of(section(text))).build();
    }

    static String numberedOptions() {
        StringBuilder sb = new StringBuilder();
        for (ApprovalChoice choice : ApprovalChoice.values()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(choice.toOptionText());
        }
        return sb.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String formatDuration(Duration duration) {
        long minutes = Math.max(0, duration.toMinutes());
        if (minutes < 60) {
            return minutes == 1 ? "1 minute" : minutes + " minutes";
        }
        return String.format("%dh %02dm", minutes / 60, minutes % 60);
    }

    private static String outcomeLine(Approval approval) {
        ApprovalStatus status = approval.getStatus();
        String who = approval.getRespondedByName() != null
            ? approval.getRespondedByName()
            : approval.getRespondedBy() != null ? "<@" + approval.getRespondedBy() + ">" : null;
        String when = approval.getRespondedAt() != null ? " at " + TIME_FORMAT.format(approval.getRespondedAt()) : "";
        return switch (status) {
            case APPROVED -> ":white_check_mark: *Approved* by " + who + when;
            case DENIED -> ":x: *Denied* by " + who + when;
            case ALWAYS_APPROVE -> ":white_check_mark: *Always approved* by " + who + when;
            case CANCELLED -> ":no_entry_sign: *Cancelled*, the session ended" + when;
            case PENDING -> ":hourglass: *Pending*";
        };
    }

    private static String metadataLines(Map<String, String> metadata) {
        StringBuilder sb = new StringBuilder();
        metadata.forEach((key, value) -> {
            if (!"risk".equals(key) && value != null && !value.isBlank()) {
                sb.append("*").append(escape(key)).append(":* ").append(escape(value)).append("\n");
            }
        });
        return sb.toString().trim();
    }

    private static List<BlockElement> buttons(String approvalId) {
        List<BlockElement> buttons = new ArrayList<>();
        buttons.add(button(ApprovalChoice.PROCEED.getActionId(), "Approve", approvalId, "primary"));
        buttons.add(button(ApprovalChoice.CANCEL.getActionId(), "Deny", approvalId, "danger"));
        buttons.add(button(ApprovalChoice.ALWAYS_APPROVE.getActionId(), "Always approve", approvalId, null));
        buttons.add(button(ADD_NOTE_ACTION, "Add note", approvalId, null));
        return buttons;
    }

    private static ButtonElement button(String actionId, String label, String value, String style) {
        return ButtonElement.builder()
            .actionId(actionId)
            .text(PlainTextObject.builder().text(label).emoji(true).build())
            .value(value)
            .style(style)
            .build();
    }

    private static HeaderBlock header(String text) {
        return HeaderBlock.builder()
            .text(PlainTextObject.builder().text(text).emoji(true).build())
            .build();
    }

    private static SectionBlock section(String markdown) {
        return SectionBlock.builder()
            .text(MarkdownTextObject.builder().text(markdown).build())
            .build();
    }

    private static ContextBlock context(String markdown) {
        List<ContextBlockElement> elements = List.of(MarkdownTextObject.builder().text(markdown).build());
        return ContextBlock.builder().elements(elements).build();
    }
}
