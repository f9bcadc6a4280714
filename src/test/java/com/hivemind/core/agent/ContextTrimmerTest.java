package com.hivemind.core.agent;

import com.hivemind.core.llm.ChatTurn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextTrimmerTest {

    private static ChatTurn turn(int tokens, String tag) {
        return ChatTurn.user(tag + "x".repeat(tokens * ContextTrimmer.CHARS_PER_TOKEN - tag.length()));
    }

    @Test
    @DisplayName("estimates four characters per token")
    void estimate() {
        assertEquals(0, ContextTrimmer.estimateTokens(null));
        assertEquals(2, ContextTrimmer.estimateTokens("12345678"));
        assertEquals(2, ContextTrimmer.estimateTokens("1234567890"));
    }

    @Test
    @DisplayName("a conversation within budget is returned unchanged")
    void withinBudget() {
        List<ChatTurn> turns = List.of(turn(10, "a"), turn(10, "b"));
        assertSame(turns, new ContextTrimmer(100).trim(turns));
    }

    @Test
    @DisplayName("keeps the first turn and the newest turns that fit, with a marker")
    void trims() {
        List<ChatTurn> turns = new ArrayList<>();
        turns.add(turn(10, "goal"));
        for (int i = 0; i < 10; i++) {
            turns.add(turn(10, "m" + i));
        }

        List<ChatTurn> trimmed = new ContextTrimmer(40).trim(turns);

        assertEquals(5, trimmed.size());
        assertTrue(trimmed.get(0).content().startsWith("goal"));
        assertEquals("[System: 7 earlier messages summarized, focus on recent context]", trimmed.get(1).content());
        assertTrue(trimmed.get(2).content().startsWith("m7"));
        assertTrue(trimmed.get(4).content().startsWith("m9"));
    }

    @Test
    @DisplayName("the first turn survives even when it alone exceeds the budget")
    void oversizedFirstTurn() {
        List<ChatTurn> turns = List.of(turn(100, "goal"), turn(5, "recent"));

        List<ChatTurn> trimmed = new ContextTrimmer(50).trim(turns);

        assertEquals(2, trimmed.size());
        assertTrue(trimmed.get(0).content().startsWith("goal"));
        assertTrue(trimmed.get(1).content().contains("1 earlier messages summarized"));
    }
}
