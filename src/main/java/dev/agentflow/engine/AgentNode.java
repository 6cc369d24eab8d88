package dev.agentflow.engine;

import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.Params;
import dev.agentflow.model.PlanResult;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for leaf agents: a synchronous planning phase followed by an
 * asynchronous run phase.
 */
public abstract class AgentNode implements FlowNode {

    private final String name;
    private final Successors successors;
    private Map<String, Object> params = Map.of();

    protected AgentNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.successors = new Successors(name);
    }

    /** Prepare execution parameters. Must not perform I/O. */
    public abstract PlanResult plan(AgentInput input);

    /** Carry out the plan. May perform I/O and complete on another thread. */
    public abstract CompletableFuture<AgentOutput> run(PlanResult plan);

    /**
     * Merge parameter bags, plan, then run. On a key collision node parameters win
     * over the input's, which win over the context's flow-level parameters.
     */
    @Override
    public final CompletableFuture<AgentOutput> execute(ContextStore context, AgentInput input) {
        Map<String, Object> flowParams = context != null ? context.flowParams() : Map.of();
        AgentInput merged = input.withParameters(Params.layer(flowParams, input.parameters(), params));
        try {
            AgentInput prepared = context != null ? beforePlan(context, merged) : merged;
            CompletableFuture<AgentOutput> pending = run(plan(prepared));
            if (pending == null) {
                return CompletableFuture.failedFuture(
                    new FlowException("Agent '" + name + "' returned no result future"));
            }
            return pending;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /** Plan and run outside of any flow. */
    public CompletableFuture<AgentOutput> execute(AgentInput input) {
        return execute(null, input);
    }

    /**
     * Hook for agents that consult the flow history before planning. The default
     * returns the input unchanged.
     */
    protected AgentInput beforePlan(ContextStore context, AgentInput input) {
        return input;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Successors successors() {
        return successors;
    }

    public Map<String, Object> params() {
        return params;
    }

    public AgentNode setParams(Map<String, ?> params) {
        this.params = Params.freeze(params);
        return this;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
