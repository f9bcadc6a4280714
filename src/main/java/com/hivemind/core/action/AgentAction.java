package com.hivemind.core.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A decision returned by the model: optional reasoning, one action and an optional chat message.
 *
 * @param thinking  reasoning text broadcast as a thought bubble, may be empty
 * @param kind      parsed action kind
 * @param rawKind   action name exactly as the model wrote it
 * @param params    typed parameters
 * @param rawParams parameters as received, forwarded verbatim in approval requests
 * @param message   chat text broadcast after the action, may be empty
 */
public record AgentAction(
        String thinking,
        ActionKind kind,
        String rawKind,
        ActionParams params,
        Map<String, Object> rawParams,
        String message
) {

    public AgentAction {
        thinking = thinking == null ? "" : thinking;
        rawKind = rawKind == null ? kind.wireName() : rawKind;
        params = params == null ? ActionParams.EMPTY : params;
        rawParams = rawParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawParams));
        message = message == null ? "" : message;
    }

    /**
     * A plain chat reply, used when the model answers with free text instead of an action.
     */
    public static AgentAction message(String text) {
        return new AgentAction("", ActionKind.MESSAGE, ActionKind.MESSAGE.wireName(), ActionParams.EMPTY, Map.of(), text);
    }

    public boolean hasMessage() {
        return !message.isBlank();
    }
}
