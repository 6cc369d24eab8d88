package dev.agentflow.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable log entry for one executed node.
 */
public record FlowRecord(
    String agentName,
    String action,
    Object result,
    Map<String, Object> metadata,
    Instant recordedAt
) {
    public FlowRecord {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(action, "action");
        metadata = Params.freeze(metadata);
        recordedAt = recordedAt == null ? Instant.now() : recordedAt;
    }

    public static FlowRecord of(String agentName, String action, Object result, Map<String, ?> metadata) {
        return new FlowRecord(agentName, action, result, Params.freeze(metadata), Instant.now());
    }
}
