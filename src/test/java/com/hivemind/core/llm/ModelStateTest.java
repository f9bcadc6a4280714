package com.hivemind.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ModelStateTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private final ModelState state = new ModelState(new ModelSpec("m", "groq", 2, 0, 0, "free"));

    @Test
    @DisplayName("requests older than the 60 s window no longer count")
    void slidingWindow() {
        state.reserveSlot(T0);
        state.reserveSlot(T0.plusSeconds(30));

        assertFalse(state.hasCapacity(T0.plusSeconds(59)));
        assertEquals(Duration.ofMillis(1_100), state.waitTime(T0.plusSeconds(59)));
        assertTrue(state.hasCapacity(T0.plusSeconds(60)));
        assertEquals(1, state.requestsInWindow(T0.plusSeconds(60)));
    }

    @Test
    @DisplayName("rate-limit cooldown doubles per streak and caps at five minutes")
    void rateLimitBackoff() {
        assertEquals(Duration.ofSeconds(120), state.recordRateLimit(T0));
        assertEquals(Duration.ofSeconds(240), state.recordRateLimit(T0));
        assertEquals(Duration.ofSeconds(300), state.recordRateLimit(T0));
        assertEquals(Duration.ofSeconds(300), state.recordRateLimit(T0));
        assertFalse(state.hasCapacity(T0.plusSeconds(299)));
    }

    @Test
    @DisplayName("an expired cooldown resets the error streak")
    void cooldownExpiry() {
        state.recordRateLimit(T0);
        assertEquals(1, state.consecutiveErrors());

        assertTrue(state.isCooledDown(T0.plusSeconds(120)));
        assertEquals(0, state.consecutiveErrors());
        assertEquals(Duration.ofSeconds(120), state.recordRateLimit(T0.plusSeconds(120)));
    }

    @Test
    @DisplayName("a shorter cooldown never shortens a longer one")
    void cooldownIsMonotonic() {
        state.markAuthFailed(T0);
        state.recordError(T0);

        assertEquals(Duration.ofSeconds(600), state.cooldownRemaining(T0));
        assertTrue(state.isAuthFailed());
    }

    @Test
    @DisplayName("success clears the auth flag")
    void successClearsAuth() {
        state.markAuthFailed(T0);
        state.recordSuccess();

        assertFalse(state.isAuthFailed());
        assertEquals(0, state.consecutiveErrors());
    }
}
