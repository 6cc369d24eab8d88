package dev.agentflow.model;

import java.util.Map;

/**
 * Result of extracting a routing action from a text response.
 */
public sealed interface ActionResult {

    /**
     * A usable action block. {@code fields} holds whatever else the block carried,
     * besides {@code action} and {@code reason}, in block order.
     */
    record Success(String action, String reason, Map<String, Object> fields) implements ActionResult {
        public Success {
            fields = Params.freeze(fields);
        }

        public Success(String action, String reason) {
            this(action, reason, Map.of());
        }
    }

    record Failure(String error, String malformedJson) implements ActionResult {}
}
