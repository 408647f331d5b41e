package com.autonomous.approval.service;

import com.autonomous.approval.exception.AlreadyResolvedException;
import com.autonomous.approval.exception.ApprovalNotFoundException;
import com.autonomous.approval.exception.PlatformException;
import com.autonomous.approval.model.Approval;
import com.autonomous.approval.model.ApprovalChoice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes verified Slack callbacks: button clicks, slash commands and thread replies.
 */
@Slf4j
@Service
public class WebhookDispatcherService {

    private final ApprovalLedgerService ledger;
    private final ChannelRegistryService channelRegistry;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public WebhookDispatcherService(ApprovalLedgerService ledger, ChannelRegistryService channelRegistry,
                                    Clock clock) {
        this.ledger = ledger;
        this.channelRegistry = channelRegistry;
        this.clock = clock;
    }

    /**
     * Handles the {@code payload} field of an interactivity request. Approval buttons
     * carry the approval id as their value.
     *
     * @throws IllegalArgumentException when the payload is not JSON
     */
    public void dispatchInteraction(String payloadJson) {
        JsonNode payload = parse(payloadJson);
        String type = payload.path("type").asText();
        if (!"block_actions".equals(type)) {
            log.debug("[Webhook] Acknowledged interaction of type {}", type);
            return;
        }
        String userId = textOrNull(payload.path("user").path("id"));
        for (JsonNode action : payload.path("actions")) {
            String actionId = action.path("action_id").asText();
            String approvalId = textOrNull(action.path("value"));
            Optional<ApprovalChoice> choice = ApprovalChoice.fromActionId(actionId);
            if (choice.isPresent()) {
                applyChoice(approvalId, choice.get(), userId);
            } else if (ApprovalMessageBuilder.ADD_NOTE_ACTION.equals(actionId)) {
                log.info("[Webhook] {} asked to add a note to approval {}", userId, approvalId);
            } else {
                log.debug("[Webhook] Ignoring action {} on {}", actionId, approvalId);
            }
        }
    }

    /**
     * Handles a slash command and returns the JSON body Slack shows to the caller.
     */
    public Map<String, Object> dispatchCommand(Map<String, String> form) {
        String command = form.getOrDefault("command", "");
        String text = form.getOrDefault("text", "").trim();
        String response = switch (command) {
            case "/approval-status" -> text.isEmpty() ? totalStatus() : sessionStatus(text);
            case "/approval-cleanup" -> cleanupReport();
            default -> "Unknown command: " + command;
        };
        return Map.of("response_type", "ephemeral", "text", response);
    }

    /**
     * Handles an Events API callback. Returns the challenge to echo for
     * {@code url_verification}.
     *
     * @throws IllegalArgumentException when the body is not JSON
     */
    public Optional<String> dispatchEvent(String rawBody) {
        JsonNode body = parse(rawBody);
        String type = body.path("type").asText();
        if ("url_verification".equals(type)) {
            return Optional.of(body.path("challenge").asText());
        }
        if ("event_callback".equals(type)) {
            handleMessageEvent(body.path("event"));
        } else {
            log.debug("[Webhook] Acknowledged event envelope of type {}", type);
        }
        return Optional.empty();
    }

    // A human reply of exactly 1, 2 or 3 under an approval message answers it.
    private void handleMessageEvent(JsonNode event) {
        if (!"message".equals(event.path("type").asText())
            || event.hasNonNull("bot_id")
            || event.hasNonNull("subtype")) {
            return;
        }
        String threadTs = textOrNull(event.path("thread_ts"));
        if (threadTs == null || threadTs.equals(textOrNull(event.path("ts")))) {
            return;
        }
        Optional<ApprovalChoice> choice = ApprovalChoice.fromText(event.path("text").asText());
        if (choice.isEmpty()) {
            return;
        }
        String channelId = textOrNull(event.path("channel"));
        Optional<Approval> approval = ledger.findByMessage(channelId, threadTs);
        if (approval.isEmpty()) {
            log.debug("[Webhook] Thread reply in {} is not under an approval message", channelId);
            return;
        }
        applyChoice(approval.get().getId(), choice.get(), textOrNull(event.path("user")));
    }

    private void applyChoice(String approvalId, ApprovalChoice choice, String userId) {
        try {
            ledger.resolve(approvalId, choice, userId);
        } catch (AlreadyResolvedException e) {
            log.warn("[Webhook] Duplicate answer from {} ignored: approval {} already {}",
                userId, e.getApprovalId(), e.getStatus().getValue());
        } catch (ApprovalNotFoundException e) {
            log.warn("[Webhook] Answer from {} for unknown approval {}", userId, approvalId);
        }
    }

    private String totalStatus() {
        List<Approval> pending = ledger.getAllPending();
        return String.format("Pending approvals: %d (active channels: %d)",
            pending.size(), channelRegistry.activeChannels().size());
    }

    private String sessionStatus(String sessionId) {
        List<Approval> pending = ledger.getPendingForSession(sessionId);
        if (pending.isEmpty()) {
            return "No pending approvals for session " + sessionId;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("*%d pending approval(s) for session %s*", pending.size(), sessionId));
        for (Approval approval : pending) {
            Duration waited = Duration.between(approval.getCreatedAt(), clock.instant());
            sb.append(String.format("\n• `%s` %s `%s` (waiting %s, %d reminders)",
                approval.getId(),
                approval.getRiskLevel().getEmoji(),
                ApprovalMessageBuilder.escape(approval.getCommand()),
                ApprovalMessageBuilder.formatDuration(waited),
                approval.getReminderCount()));
        }
        return sb.toString();
    }

    private String cleanupReport() {
        try {
            long archived = channelRegistry.countArchivedApprovalChannels();
            return String.format("Found %d archived channels (cleanup requires Enterprise Grid)", archived);
        } catch (PlatformException e) {
            log.warn("[Webhook] Cleanup report failed: {}", e.getMessage());
            return "Slack is unavailable, try again later.";
        }
    }

    private JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty Slack payload");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed Slack payload: " + e.getOriginalMessage(), e);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }
}
