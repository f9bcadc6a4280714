package com.hivemind.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hivemind.agent")
public class AgentProperties {

    /** Consecutive loop failures before an agent pauses itself. */
    private int maxConsecutiveErrors = 5;

    private Duration cycleDelay = Duration.ofSeconds(3);
    private Duration idleDelay = Duration.ofSeconds(2);
    private Duration pausedDelay = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofSeconds(30);
    private Duration approvalTimeout = Duration.ofMinutes(5);

    /** Estimated token budget for the conversation sent to the model. */
    private int contextMaxTokens = 200_000;

    /** Failures on one task before the agent is told to step back and reflect. */
    private int reflectionThreshold = 2;

    private Duration suggestionDedupWindow = Duration.ofMinutes(2);

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    public Duration getCycleDelay() {
        return cycleDelay;
    }

    public void setCycleDelay(Duration cycleDelay) {
        this.cycleDelay = cycleDelay;
    }

    public Duration getIdleDelay() {
        return idleDelay;
    }

    public void setIdleDelay(Duration idleDelay) {
        this.idleDelay = idleDelay;
    }

    public Duration getPausedDelay() {
        return pausedDelay;
    }

    public void setPausedDelay(Duration pausedDelay) {
        this.pausedDelay = pausedDelay;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getApprovalTimeout() {
        return approvalTimeout;
    }

    public void setApprovalTimeout(Duration approvalTimeout) {
        this.approvalTimeout = approvalTimeout;
    }

    public int getContextMaxTokens() {
        return contextMaxTokens;
    }

    public void setContextMaxTokens(int contextMaxTokens) {
        this.contextMaxTokens = contextMaxTokens;
    }

    public int getReflectionThreshold() {
        return reflectionThreshold;
    }

    public void setReflectionThreshold(int reflectionThreshold) {
        this.reflectionThreshold = reflectionThreshold;
    }

    public Duration getSuggestionDedupWindow() {
        return suggestionDedupWindow;
    }

    public void setSuggestionDedupWindow(Duration suggestionDedupWindow) {
        this.suggestionDedupWindow = suggestionDedupWindow;
    }
}
