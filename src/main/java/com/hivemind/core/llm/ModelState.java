package com.hivemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rate-limit and health bookkeeping for one model. Not thread-safe: the router
 * mutates every instance under its own lock.
 */
final class ModelState {

    private static final Logger log = LoggerFactory.getLogger(ModelState.class);

    static final Duration WINDOW = Duration.ofSeconds(60);
    static final Duration ERROR_COOLDOWN = Duration.ofSeconds(10);
    static final Duration NOT_FOUND_COOLDOWN = Duration.ofSeconds(300);
    static final Duration AUTH_COOLDOWN = Duration.ofSeconds(600);
    static final long RATE_LIMIT_BASE_SECONDS = 60;
    static final long RATE_LIMIT_MAX_SECONDS = 300;

    private final ModelSpec spec;
    private final Deque<Instant> requestTimes = new ArrayDeque<>();
    private Instant cooldownUntil = Instant.EPOCH;
    private int consecutiveErrors;
    private boolean authFailed;

    ModelState(ModelSpec spec) {
        this.spec = spec;
    }

    ModelSpec spec() {
        return spec;
    }

    String name() {
        return spec.name();
    }

    boolean isCooledDown(Instant now) {
        if (!now.isBefore(cooldownUntil)) {
            if (consecutiveErrors > 0) {
                log.info("Model {} cooldown expired, resetting for retry", spec.name());
                consecutiveErrors = 0;
            }
            return true;
        }
        return false;
    }

    int requestsInWindow(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!requestTimes.isEmpty() && !requestTimes.peekFirst().isAfter(cutoff)) {
            requestTimes.pollFirst();
        }
        return requestTimes.size();
    }

    boolean hasCapacity(Instant now) {
        return isCooledDown(now) && requestsInWindow(now) < spec.rpm();
    }

    void reserveSlot(Instant now) {
        requestTimes.addLast(now);
    }

    void recordSuccess() {
        consecutiveErrors = 0;
        authFailed = false;
    }

    /**
     * Cools the model down for {@code min(60 * 2^n, 300)} seconds, n being the error streak.
     */
    Duration recordRateLimit(Instant now) {
        consecutiveErrors++;
        long seconds = Math.min(RATE_LIMIT_BASE_SECONDS << Math.min(consecutiveErrors, 10), RATE_LIMIT_MAX_SECONDS);
        Duration backoff = Duration.ofSeconds(seconds);
        cooldownUntil = now.plus(backoff);
        log.warn("Model {} rate-limited, cooling down for {}s", spec.name(), seconds);
        return backoff;
    }

    Duration recordError(Instant now) {
        consecutiveErrors++;
        return cooldown(now, ERROR_COOLDOWN);
    }

    Duration cooldown(Instant now, Duration duration) {
        Instant until = now.plus(duration);
        if (until.isAfter(cooldownUntil)) {
            cooldownUntil = until;
        }
        return duration;
    }

    Duration markAuthFailed(Instant now) {
        authFailed = true;
        consecutiveErrors++;
        return cooldown(now, AUTH_COOLDOWN);
    }

    boolean isAuthFailed() {
        return authFailed;
    }

    int consecutiveErrors() {
        return consecutiveErrors;
    }

    Duration cooldownRemaining(Instant now) {
        return now.isBefore(cooldownUntil) ? Duration.between(now, cooldownUntil) : Duration.ZERO;
    }

    /**
     * Time until this model can take another request, zero when it can right now.
     */
    Duration waitTime(Instant now) {
        if (!isCooledDown(now)) {
            return Duration.between(now, cooldownUntil);
        }
        if (requestsInWindow(now) >= spec.rpm()) {
            Instant oldest = requestTimes.peekFirst();
            return Duration.between(now, oldest.plus(WINDOW)).plusMillis(100);
        }
        return Duration.ZERO;
    }

    ModelStatus toStatus(Instant now, boolean active) {
        return new ModelStatus(
                spec.name(),
                spec.provider(),
                spec.tier(),
                active,
                hasCapacity(now),
                requestsInWindow(now),
                spec.rpm(),
                isCooledDown(now),
                cooldownRemaining(now),
                authFailed,
                spec.costInPer1M(),
                spec.costOutPer1M());
    }
}
