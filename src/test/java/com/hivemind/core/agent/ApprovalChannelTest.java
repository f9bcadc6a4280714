package com.hivemind.core.agent;

import com.hivemind.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalChannelTest {

    private final ApprovalChannel channel = new ApprovalChannel("developer", new MutableClock());

    @Test
    @DisplayName("open records a pending request with an 8 character id")
    void open() {
        ApprovalRequest request = channel.open("run_command", Map.of("command", "rm -rf build"), "wants to run");

        assertEquals(8, request.id().length());
        assertEquals("developer", request.agentId());
        assertEquals("run_command", request.actionType());
        assertEquals(1, channel.pending().size());
    }

    @Test
    @DisplayName("a decision made before await is returned immediately")
    void resolvedBeforeAwait() throws Exception {
        ApprovalRequest request = channel.open("delete_file", Map.of("path", "a.py"), "delete");

        assertTrue(channel.resolve(request.id(), true));

        assertEquals(ApprovalDecision.APPROVED, channel.await(request.id(), Duration.ofSeconds(5)));
        assertTrue(channel.pending().isEmpty());
    }

    @Test
    @DisplayName("await blocks until another thread resolves")
    void resolvedFromAnotherThread() throws Exception {
        ApprovalRequest request = channel.open("run_command", Map.of(), "run");

        CompletableFuture<ApprovalDecision> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.await(request.id(), Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        while (channel.pending().isEmpty()) {
            Thread.onSpinWait();
        }
        channel.resolve(request.id(), false);

        ApprovalDecision decision = waiting.get(5, TimeUnit.SECONDS);
        assertEquals(ApprovalDecision.REJECTED, decision);
        assertFalse(decision.isApproved());
    }

    @Test
    @DisplayName("an unanswered request times out and can no longer be resolved")
    void timeout() throws Exception {
        ApprovalRequest request = channel.open("run_command", Map.of(), "run");

        assertEquals(ApprovalDecision.TIMED_OUT, channel.await(request.id(), Duration.ofMillis(20)));
        assertFalse(channel.resolve(request.id(), true));
        assertTrue(channel.pending().isEmpty());
    }

    @Test
    @DisplayName("cancelAll cancels every pending request once")
    void cancelAll() throws Exception {
        ApprovalRequest first = channel.open("run_command", Map.of(), "one");
        channel.open("run_command", Map.of(), "two");

        assertEquals(2, channel.cancelAll());
        assertEquals(0, channel.cancelAll());
        assertEquals(ApprovalDecision.CANCELLED, channel.await(first.id(), Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("awaiting an unknown id is an error")
    void unknown() {
        assertThrows(IllegalArgumentException.class, () -> channel.await("nope", Duration.ofMillis(10)));
        assertFalse(channel.resolve("nope", true));
    }
}
