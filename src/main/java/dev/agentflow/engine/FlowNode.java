package dev.agentflow.engine;

import dev.agentflow.model.Action;
import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Anything that can sit in a flow graph: leaf agents and whole flows alike.
 *
 * <p>Builder methods return the node passed in, so {@code a.next(b).next(c)} wires
 * the linear default path a, b, c.
 */
public interface FlowNode {

    String name();

    /**
     * Execute this node against the shared context. Failures are reported through the
     * returned future; the exception is the one the node raised.
     */
    CompletableFuture<AgentOutput> execute(ContextStore context, AgentInput input);

    Successors successors();

    default <T extends FlowNode> T next(T node) {
        return next(node, Action.DEFAULT_LABEL);
    }

    default <T extends FlowNode> T next(T node, String action) {
        successors().register(action, node);
        return node;
    }

    default <T extends FlowNode> T next(T node, Action action) {
        return next(node, action.label());
    }

    default <T extends FlowNode> T onDefault(T node) {
        return next(node, Action.DEFAULT_LABEL);
    }

    default <T extends FlowNode> T on(String action, T node) {
        return next(node, action);
    }

    default ConditionalTransition on(String action) {
        return new ConditionalTransition(this, action);
    }

    default Optional<FlowNode> getNextNode(String action) {
        return successors().resolve(action);
    }
}
