package com.hivemind.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pending approvals of one agent. Each request is resolved exactly once: by a human,
 * by timing out, or by cancellation when the agent stops.
 */
public class ApprovalChannel {

    private static final Logger log = LoggerFactory.getLogger(ApprovalChannel.class);

    private final String agentId;
    private final Clock clock;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private record Pending(ApprovalRequest request, CompletableFuture<ApprovalDecision> decision) {}

    public ApprovalChannel(String agentId, Clock clock) {
        this.agentId = agentId;
        this.clock = clock;
    }

    public ApprovalRequest open(String actionType, Map<String, Object> params, String description) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        ApprovalRequest request = new ApprovalRequest(id, agentId, actionType, params, description, clock.instant());
        pending.put(id, new Pending(request, new CompletableFuture<>()));
        return request;
    }

    /**
     * Blocks until the request is resolved or {@code timeout} passes.
     */
    public ApprovalDecision await(String approvalId, Duration timeout) throws InterruptedException {
        Pending entry = pending.get(approvalId);
        if (entry == null) {
            throw new IllegalArgumentException("No pending approval " + approvalId);
        }
        try {
            return entry.decision().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[{}] Approval {} timed out after {}", agentId, approvalId, timeout);
            complete(approvalId, ApprovalDecision.TIMED_OUT);
            return entry.decision().getNow(ApprovalDecision.TIMED_OUT);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Approval " + approvalId + " failed", e.getCause());
        } finally {
            pending.remove(approvalId);
        }
    }

    /**
     * @return false when no such request is pending (already resolved, timed out or unknown)
     */
    public boolean resolve(String approvalId, boolean approved) {
        return complete(approvalId, approved ? ApprovalDecision.APPROVED : ApprovalDecision.REJECTED);
    }

    /**
     * Cancels every pending request.
     *
     * @return how many were cancelled
     */
    public int cancelAll() {
        int cancelled = 0;
        for (String id : List.copyOf(pending.keySet())) {
            if (complete(id, ApprovalDecision.CANCELLED)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public List<ApprovalRequest> pending() {
        return pending.values().stream().map(Pending::request).toList();
    }

    private boolean complete(String approvalId, ApprovalDecision decision) {
        Pending entry = pending.get(approvalId);
        return entry != null && entry.decision().complete(decision);
    }
}
