package com.hivemind.core.agent;

import com.hivemind.core.llm.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps a conversation inside an estimated token budget: the first turn (the mission
 * goal or first observation) always survives, then the newest turns that fit, with a
 * marker standing in for everything dropped in between.
 */
public final class ContextTrimmer {

    private static final Logger log = LoggerFactory.getLogger(ContextTrimmer.class);

    static final int CHARS_PER_TOKEN = 4;

    private final int maxTokens;

    public ContextTrimmer(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }

    public List<ChatTurn> trim(List<ChatTurn> turns) {
        if (turns.isEmpty()) {
            return turns;
        }
        int total = 0;
        for (ChatTurn turn : turns) {
            total += estimateTokens(turn.content());
        }
        if (total <= maxTokens) {
            return turns;
        }

        ChatTurn first = turns.get(0);
        int remaining = maxTokens - estimateTokens(first.content());
        List<ChatTurn> recent = new ArrayList<>();
        for (int i = turns.size() - 1; i >= 1; i--) {
            int cost = estimateTokens(turns.get(i).content());
            if (remaining - cost < 0) {
                break;
            }
            recent.add(turns.get(i));
            remaining -= cost;
        }
        Collections.reverse(recent);

        List<ChatTurn> result = new ArrayList<>(recent.size() + 2);
        result.add(first);
        int dropped = turns.size() - 1 - recent.size();
        if (dropped > 0) {
            result.add(ChatTurn.user("[System: " + dropped
                    + " earlier messages summarized, focus on recent context]"));
        }
        result.addAll(recent);
        log.info("Context trimmed: {} -> {} messages (~{} tokens before)", turns.size(), result.size(), total);
        return result;
    }
}
