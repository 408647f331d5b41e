package com.autonomous.approval.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The three numbered answers offered with every approval request, in the
 * order they are presented to the human.
 */
public enum ApprovalChoice {
    PROCEED(1, "Yes, proceed", "approve_command", ApprovalStatus.APPROVED),
    CANCEL(2, "No, cancel", "deny_command", ApprovalStatus.DENIED),
    ALWAYS_APPROVE(3, "Always approve this kind", "always_approve_command", ApprovalStatus.ALWAYS_APPROVE);

    private final int number;
    private final String label;
    private final String actionId;
    private final ApprovalStatus status;

    ApprovalChoice(int number, String label, String actionId, ApprovalStatus status) {
        this.number = number;
        this.label = label;
        this.actionId = actionId;
        this.status = status;
    }

    public int getNumber() {
        return number;
    }

    public String getLabel() {
        return label;
    }

    public String getActionId() {
        return actionId;
    }

    public ApprovalStatus getStatus() {
        return status;
    }

    /** Renders the choice the way the terminal prompt shows it, e.g. {@code [1] Yes, proceed}. */
    public String toOptionText() {
        return String.format("[%d] %s", number, label);
    }

    public static Optional<ApprovalChoice> fromNumber(int number) {
        return Arrays.stream(values()).filter(c -> c.number == number).findFirst();
    }

    public static Optional<ApprovalChoice> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!trimmed.matches("[1-3]")) {
            return Optional.empty();
        }
        return fromNumber(Integer.parseInt(trimmed));
    }

    public static Optional<ApprovalChoice> fromActionId(String actionId) {
        return Arrays.stream(values()).filter(c -> c.actionId.equals(actionId)).findFirst();
    }
}
