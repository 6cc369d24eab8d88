package dev.agentflow.engine;

import java.util.Objects;

/**
 * Half-built edge: a source node and the action label it will route on.
 * {@link #to(FlowNode)} completes it.
 */
public record ConditionalTransition(FlowNode source, String action) {

    public ConditionalTransition {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(action, "action");
    }

    /** Register {@code target} under this transition's action and return the target. */
    public <T extends FlowNode> T to(T target) {
        return source.next(target, action);
    }
}
