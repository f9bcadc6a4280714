package com.hivemind.core.bus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable bus message.
 *
 * @param id         UUID assigned at publish time
 * @param timestamp  publish time
 * @param sender     agent id of the publisher ("system" or "user" for non-agents)
 * @param senderRole role of the publisher
 * @param type       message kind
 * @param content    human-readable text
 * @param data       structured payload
 * @param mentions   agent ids the message is addressed to; empty for broadcast
 * @param channel    logical channel, "general" by default
 */
public record Message(
    String id,
    Instant timestamp,
    String sender,
    String senderRole,
    MessageType type,
    String content,
    Map<String, Object> data,
    List<String> mentions,
    String channel
) {

    public static final String DEFAULT_CHANNEL = "general";

    public Message {
        content = content == null ? "" : content;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
        channel = channel == null || channel.isBlank() ? DEFAULT_CHANNEL : channel;
    }

    public boolean mentions(String agentId) {
        return mentions.contains(agentId);
    }

    /**
     * Whether an agent other than the sender should receive this message.
     */
    public boolean isDeliverableTo(String agentId) {
        if (agentId.equals(sender)) {
            return false;
        }
        return mentions.isEmpty() || mentions.contains(agentId) || type.isBroadcast();
    }
}
