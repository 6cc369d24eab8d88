package dev.agentflow.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a node's run phase. The "action" metadata entry, if any, selects the
 * node's successor.
 */
public record AgentOutput(
    Object result,
    String plan, // nullable
    List<String> toolsUsed,
    Map<String, Object> metadata
) {
    public AgentOutput {
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        metadata = Params.freeze(metadata);
    }

    public static AgentOutput of(Object result) {
        return new AgentOutput(result, null, null, null);
    }

    public static AgentOutput routed(Object result, String action) {
        return new AgentOutput(result, null, null, Map.of(Action.METADATA_KEY, action));
    }

    public static AgentOutput routed(Object result, Action action) {
        return routed(result, action.label());
    }

    public AgentOutput withMetadata(String key, Object value) {
        return new AgentOutput(result, plan, toolsUsed, Params.layer(metadata, singleton(key, value)));
    }

    public AgentOutput withPlan(String newPlan) {
        return new AgentOutput(result, newPlan, toolsUsed, metadata);
    }

    /** Routing label derived from metadata; {@code "default"} when none was set. */
    public String action() {
        return Action.fromMetadata(metadata);
    }

    private static Map<String, Object> singleton(String key, Object value) {
        var entry = new LinkedHashMap<String, Object>();
        entry.put(key, value);
        return entry;
    }
}
