package com.autonomous.approval.service;

import com.autonomous.approval.model.Approval;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory store of every approval the process has seen. Approvals are never removed.
 */
@Repository
public class ApprovalRepository {

    private final Map<String, Approval> approvals = new ConcurrentHashMap<>();

    public void save(Approval approval) {
        approvals.put(approval.getId(), approval);
    }

    public Optional<Approval> findById(String approvalId) {
        return approvalId == null ? Optional.empty() : Optional.ofNullable(approvals.get(approvalId));
    }

    public Optional<Approval> findByMessage(String channelId, String messageTs) {
        return approvals.values().stream()
            .filter(a -> Objects.equals(a.getChannelId(), channelId))
            .filter(a -> messageTs != null && messageTs.equals(a.getMessageTs()))
            .findFirst();
    }

    public List<Approval> findBySession(String sessionId) {
        return approvals.values().stream()
            .filter(a -> a.getSessionId().equals(sessionId))
            .sorted(Comparator.comparing(Approval::getCreatedAt))
            .collect(Collectors.toList());
    }

    public List<Approval> findPending() {
        return approvals.values().stream()
            .filter(Approval::isPending)
            .sorted(Comparator.comparing(Approval::getCreatedAt))
            .collect(Collectors.toList());
    }

    public int count() {
        return approvals.size();
    }
}
