package com.hivemind.core.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts raw model output into an {@link AgentAction}.
 * <p>
 * Expected shape: {@code {"thinking": "...", "action": "edit_file", "params": {...}, "message": "..."}},
 * optionally wrapped in a markdown code fence. Text that is not a JSON object becomes a
 * {@code message} action carrying the text, so a chatty model never stalls an agent.
 */
@Component
public class ActionParser {

    private static final Logger log = LoggerFactory.getLogger(ActionParser.class);

    private static final TypeReference<LinkedHashMap<String, Object>> RAW_PARAMS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ActionParser() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public AgentAction parse(String text) {
        if (text == null || text.isBlank()) {
            return AgentAction.message("");
        }
        String cleaned = stripFences(text);
        JsonNode root;
        try {
            root = mapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("Model output is not JSON, treating as chat ({} chars)", cleaned.length());
            return AgentAction.message(cleaned);
        }
        if (root == null || !root.isObject()) {
            return AgentAction.message(cleaned);
        }

        String rawKind = root.path("action").asText("");
        ActionKind kind = ActionKind.fromWire(rawKind);
        JsonNode paramsNode = root.path("params");
        if (!paramsNode.isObject()) {
            paramsNode = mapper.createObjectNode();
        }

        ActionParams params;
        Map<String, Object> rawParams;
        try {
            params = mapper.treeToValue(paramsNode, ActionParams.class);
            rawParams = mapper.convertValue(paramsNode, RAW_PARAMS);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Malformed params for action '{}': {}", rawKind, e.getMessage());
            return AgentAction.message(cleaned);
        }
        if (kind == ActionKind.UNKNOWN) {
            log.warn("Unknown action kind '{}'", rawKind);
        }

        return new AgentAction(
                root.path("thinking").asText(""),
                kind,
                rawKind.isBlank() ? kind.wireName() : rawKind,
                params,
                rawParams,
                root.path("message").asText(""));
    }

    /**
     * Serializes an action back to the JSON shape the model produces, for conversation history.
     */
    public String render(AgentAction action) {
        ObjectNode node = mapper.createObjectNode();
        node.put("thinking", action.thinking());
        node.put("action", action.rawKind());
        node.set("params", mapper.valueToTree(action.rawParams()));
        node.put("message", action.message());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ActionParseException("Failed to render action " + action.rawKind(), e);
        }
    }

    /**
     * Serializes an arbitrary value (task snapshot, directory listing) as indented JSON.
     */
    public String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ActionParseException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int newline = cleaned.indexOf('\n');
            cleaned = newline >= 0 ? cleaned.substring(newline + 1) : cleaned.substring(3);
            int closing = cleaned.lastIndexOf("```");
            if (closing >= 0) {
                cleaned = cleaned.substring(0, closing);
            }
        }
        return cleaned.trim();
    }
}
