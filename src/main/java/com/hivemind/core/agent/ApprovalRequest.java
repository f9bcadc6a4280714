package com.hivemind.core.agent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action waiting for a human decision.
 *
 * @param id          8-character identifier quoted back in {@code resolveApproval}
 * @param agentId     agent that asked
 * @param actionType  action name, e.g. {@code run_command}
 * @param params      action parameters as the model sent them
 * @param description human-readable summary
 * @param createdAt   when the request was opened
 */
public record ApprovalRequest(
    String id,
    String agentId,
    String actionType,
    Map<String, Object> params,
    String description,
    Instant createdAt
) {

    public ApprovalRequest {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
