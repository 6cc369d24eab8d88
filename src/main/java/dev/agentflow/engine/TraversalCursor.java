package dev.agentflow.engine;

import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;

import java.util.OptionalInt;

/**
 * Position of one run inside a {@link FlowGraph}. Owned by a single invocation and
 * never shared, so concurrent runs over the same graph cannot disturb each other.
 */
final class TraversalCursor {

    private final FlowGraph graph;
    private final AgentInput originalInput;
    private final InputPropagation propagation;
    private int position;
    private AgentInput input;
    private int steps;

    TraversalCursor(FlowGraph graph, AgentInput input, InputPropagation propagation) {
        this.graph = graph;
        this.originalInput = input;
        this.propagation = propagation;
        this.position = graph.start();
        this.input = input;
    }

    FlowNode current() {
        return graph.node(position);
    }

    AgentInput input() {
        return input;
    }

    int steps() {
        return steps;
    }

    /**
     * Move past the node that just produced {@code output}.
     *
     * @return false when no successor resolves and traversal is over
     */
    boolean advance(String action, AgentOutput output) {
        steps++;
        OptionalInt next = graph.next(position, action);
        if (next.isEmpty()) {
            return false;
        }
        input = propagation.nextInput(originalInput, input, current().name(), action, output);
        position = next.getAsInt();
        return true;
    }
}
