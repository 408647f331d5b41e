package com.autonomous.approval.service;

import com.autonomous.approval.model.ResolvedApproval;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Callback URLs waiting for an approval to resolve. Registration and completion
 * share one lock, so a URL registered while the approval resolves is either
 * drained by the completion or answered with the result immediately.
 */
@Component
public class ApprovalCallbackRegistry {

    private final Map<String, List<String>> waiting = new HashMap<>();
    private final Map<String, ResolvedApproval> completed = new HashMap<>();

    /**
     * @return the result when the approval already resolved, in which case the URL
     *         is not kept
     */
    public synchronized Optional<ResolvedApproval> register(String approvalId, String callbackUrl) {
        ResolvedApproval done = completed.get(approvalId);
        if (done != null) {
            return Optional.of(done);
        }
        waiting.computeIfAbsent(approvalId, id -> new ArrayList<>()).add(callbackUrl);
        return Optional.empty();
    }

    public synchronized List<String> complete(ResolvedApproval resolved) {
        completed.put(resolved.getApprovalId(), resolved);
        List<String> urls = waiting.remove(resolved.getApprovalId());
        return urls != null ? urls : List.of();
    }

    public synchronized int waitingCount(String approvalId) {
        return waiting.getOrDefault(approvalId, List.of()).size();
    }
}
