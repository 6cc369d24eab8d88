package dev.agentflow.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a node's planning phase, consumed by its run phase.
 */
public record PlanResult(
    String plan,
    AgentInput input,
    List<String> toolsToUse,
    Map<String, Object> parameters,
    Map<String, Object> metadata
) {
    public PlanResult {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(input, "input");
        toolsToUse = toolsToUse == null ? List.of() : List.copyOf(toolsToUse);
        parameters = Params.freeze(parameters);
        metadata = Params.freeze(metadata);
    }

    /** Plan that carries the input's own tools and parameters through unchanged. */
    public static PlanResult of(String plan, AgentInput input) {
        return new PlanResult(plan, input, input.tools(), input.parameters(), null);
    }
}
