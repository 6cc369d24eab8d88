package dev.agentflow.agents;

import dev.agentflow.engine.AgentNode;
import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.PlanResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Agent whose run phase is a plain function of its (parameter-merged) input.
 */
public class FunctionAgent extends AgentNode {

    private final Function<AgentInput, CompletableFuture<AgentOutput>> body;

    protected FunctionAgent(String name, Function<AgentInput, CompletableFuture<AgentOutput>> body) {
        super(name);
        this.body = Objects.requireNonNull(body, "body");
    }

    public static FunctionAgent of(String name, Function<AgentInput, AgentOutput> body) {
        Objects.requireNonNull(body, "body");
        return new FunctionAgent(name, input -> CompletableFuture.completedFuture(body.apply(input)));
    }

    public static FunctionAgent async(String name, Function<AgentInput, CompletableFuture<AgentOutput>> body) {
        return new FunctionAgent(name, body);
    }

    @Override
    public PlanResult plan(AgentInput input) {
        return PlanResult.of("Apply " + name() + " to: " + input.query(), input);
    }

    @Override
    public CompletableFuture<AgentOutput> run(PlanResult plan) {
        return body.apply(plan.input());
    }
}
