package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the swarm.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Model routing ---

    /**
     * @param outcome "success", "rate_limited", "auth", "not_found", "invalid_request", "server" or "other"
     */
    public void recordModelRequest(String model, String outcome) {
        Counter.builder("hivemind.model.requests")
                .tag("model", model)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordModelLatency(String model, Duration elapsed) {
        Timer.builder("hivemind.model.latency")
                .tag("model", model)
                .register(registry)
                .record(elapsed);
    }

    public void recordCooldown(String model, String reason, Duration cooldown) {
        Counter.builder("hivemind.model.cooldowns")
                .description("Models taken out of rotation after a provider error")
                .tag("model", model)
                .tag("reason", reason)
                .register(registry)
                .increment();
        DistributionSummary.builder("hivemind.model.cooldown_seconds")
                .tag("reason", reason)
                .register(registry)
                .record(cooldown.toSeconds());
    }

    public void recordTokens(String model, long inputTokens, long outputTokens) {
        Counter.builder("hivemind.tokens")
                .tag("model", model)
                .tag("direction", "input")
                .register(registry)
                .increment(inputTokens);
        Counter.builder("hivemind.tokens")
                .tag("model", model)
                .tag("direction", "output")
                .register(registry)
                .increment(outputTokens);
    }

    public void recordCost(double usd) {
        Counter.builder("hivemind.cost.usd")
                .description("Estimated model spend")
                .register(registry)
                .increment(usd);
    }

    public void recordBudgetEvent(String event) {
        Counter.builder("hivemind.budget.events")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("hivemind.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // --- Agents ---

    public void recordAction(String role, String action) {
        Counter.builder("hivemind.agent.actions")
                .tag("role", role)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordAgentError(String role) {
        Counter.builder("hivemind.agent.errors")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    public void recordAgentPaused(String role) {
        Counter.builder("hivemind.agent.auto_pauses")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    /**
     * @param decision "approved", "rejected", "timed_out" or "cancelled"
     */
    public void recordApproval(String decision) {
        Counter.builder("hivemind.approvals")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordStaleRead() {
        Counter.builder("hivemind.workspace.stale_reads")
                .description("Edits rejected because the agent's view of the file was outdated")
                .register(registry)
                .increment();
    }

    public void recordMissionResult(String status) {
        Counter.builder("hivemind.missions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordMissionDuration(Duration duration) {
        Timer.builder("hivemind.mission.duration")
                .register(registry)
                .record(duration);
    }
}
