package dev.agentflow.engine;

import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.Params;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives a flow from its start node until no successor resolves, recording every step
 * in the caller's {@link ContextStore}. The result of a run is the last node's output.
 *
 * <p>An orchestrator is itself a {@link FlowNode}, so a whole flow can be registered as
 * a successor in another flow. Its inner steps go into the same context as the
 * parent's, followed by one record for the sub-flow itself.
 *
 * <p>There is no cycle detection and no iteration cap: a cyclic graph whose routing
 * never resolves to nothing runs until the caller gives up on the future.
 */
public class FlowOrchestrator implements FlowNode {

    private static final Logger log = LoggerFactory.getLogger(FlowOrchestrator.class);

    private final String name;
    private final Successors successors;
    private FlowNode startNode;
    private Map<String, Object> params = Map.of();
    private InputPropagation inputPropagation = InputPropagation.ORIGINAL_INPUT;

    public FlowOrchestrator() {
        this("flow");
    }

    public FlowOrchestrator(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.successors = new Successors(name);
    }

    public FlowOrchestrator(String name, FlowNode startNode) {
        this(name);
        start(startNode);
    }

    /** Set the start node and return it, so the rest of the graph can be chained from it. */
    public <T extends FlowNode> T start(T node) {
        this.startNode = Objects.requireNonNull(node, "Start node cannot be null");
        return node;
    }

    public Optional<FlowNode> startNode() {
        return Optional.ofNullable(startNode);
    }

    public FlowOrchestrator setParams(Map<String, ?> params) {
        this.params = Params.freeze(params);
        return this;
    }

    public Map<String, Object> params() {
        return params;
    }

    public FlowOrchestrator inputPropagation(InputPropagation mode) {
        this.inputPropagation = Objects.requireNonNull(mode, "mode");
        return this;
    }

    public InputPropagation inputPropagation() {
        return inputPropagation;
    }

    /** Snapshot of the topology a run started now would traverse. */
    public FlowGraph graph() {
        if (startNode == null) {
            throw new FlowException("Flow '" + name + "' has no start node");
        }
        return FlowGraph.of(startNode);
    }

    /**
     * Run the flow. The returned future completes with the last executed node's output,
     * or fails with the exception the failing node raised. Records written before a
     * failure stay in {@code context}.
     */
    public CompletableFuture<AgentOutput> runAsync(ContextStore context, AgentInput input) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(input, "input");

        FlowNode start = this.startNode;
        if (start == null) {
            return CompletableFuture.failedFuture(new FlowException("Flow '" + name + "' has no start node"));
        }

        AgentInput scoped = params.isEmpty()
            ? input
            : input.withParameters(Params.layer(input.parameters(), params));
        var cursor = new TraversalCursor(FlowGraph.of(start), scoped, inputPropagation);
        var done = new CompletableFuture<AgentOutput>();

        log.debug("Flow '{}' starting at '{}'", name, start.name());
        resume(cursor, context, done);
        return done;
    }

    /**
     * Blocking form of {@link #runAsync}. Unchecked exceptions raised by a node are
     * rethrown as they are; checked ones are wrapped in {@link FlowException}.
     */
    public AgentOutput run(ContextStore context, AgentInput input) {
        try {
            return runAsync(context, input).join();
        } catch (CompletionException e) {
            throw propagate(unwrap(e));
        }
    }

    @Override
    public CompletableFuture<AgentOutput> execute(ContextStore context, AgentInput input) {
        return runAsync(context, input);
    }

    // Nothing thrown from the loop, Errors included, may leave done pending.
    private void resume(TraversalCursor cursor, ContextStore context, CompletableFuture<AgentOutput> done) {
        try {
            drive(cursor, context, done);
        } catch (Throwable t) {
            done.completeExceptionally(t);
        }
    }

    // Drains synchronously completed steps in a loop; an asynchronous step resumes the
    // loop from its completion callback, so long runs do not grow the stack.
    private void drive(TraversalCursor cursor, ContextStore context, CompletableFuture<AgentOutput> done) {
        while (true) {
            FlowNode node = cursor.current();
            CompletableFuture<AgentOutput> pending = invoke(node, context, cursor.input());

            if (!pending.isDone()) {
                pending.whenComplete((output, error) -> {
                    if (settle(cursor, context, node, output, error, done)) {
                        resume(cursor, context, done);
                    }
                });
                return;
            }

            AgentOutput output = null;
            Throwable error = null;
            try {
                output = pending.join();
            } catch (CompletionException | CancellationException e) {
                error = e;
            }
            if (!settle(cursor, context, node, output, error, done)) {
                return;
            }
        }
    }

    private CompletableFuture<AgentOutput> invoke(FlowNode node, ContextStore context, AgentInput input) {
        try (FlowMdc.Scope ignored = FlowMdc.step(name, node.name())) {
            CompletableFuture<AgentOutput> pending = node.execute(context, input);
            if (pending == null) {
                return CompletableFuture.failedFuture(
                    new FlowException("Node '" + node.name() + "' returned no result future"));
            }
            return pending;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * Record the finished step and move the cursor.
     *
     * @return true when traversal should continue with the cursor's new node
     */
    private boolean settle(TraversalCursor cursor, ContextStore context, FlowNode node,
                           AgentOutput output, Throwable error, CompletableFuture<AgentOutput> done) {
        try (FlowMdc.Scope ignored = FlowMdc.step(name, node.name())) {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.debug("Flow '{}' aborted at '{}' after {} steps: {}", name, node.name(), cursor.steps(), cause.toString());
                done.completeExceptionally(cause);
                return false;
            }
            if (output == null) {
                done.completeExceptionally(new FlowException("Node '" + node.name() + "' completed without output"));
                return false;
            }

            String action = output.action();
            context.recordFlowStep(node.name(), action, output.result(), output.metadata());
            log.debug("Flow '{}' step {}: '{}' -> action '{}'", name, cursor.steps() + 1, node.name(), action);

            if (!cursor.advance(action, output)) {
                log.debug("Flow '{}' finished after {} steps at '{}'", name, cursor.steps(), node.name());
                done.complete(output);
                return false;
            }
            return true;
        } catch (Throwable t) {
            done.completeExceptionally(t);
            return false;
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new FlowException("Flow failed: " + cause.getMessage(), cause);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Successors successors() {
        return successors;
    }

    @Override
    public String toString() {
        return "FlowOrchestrator[" + name + "]";
    }
}
