package dev.agentflow.cli;

import dev.agentflow.agents.FunctionAgent;
import dev.agentflow.agents.KeywordRouterAgent;
import dev.agentflow.engine.AgentNode;
import dev.agentflow.engine.ContextStore;
import dev.agentflow.engine.FlowOrchestrator;
import dev.agentflow.engine.InputPropagation;
import dev.agentflow.model.Action;
import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.FlowSummary;
import dev.agentflow.model.PlanResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Built-in demo flow run by the command line.
 *
 * <pre>
 * triage --complex--> deep-work [outline -> review] --default--> report
 *        --simple---> answer ---------------------------default--> report
 * </pre>
 */
public final class TriageFlow {

    public static final String MAX_STEPS_PARAM = "maxSteps";
    static final int DEFAULT_MAX_STEPS = 5;

    private TriageFlow() {}

    public static FlowOrchestrator build() {
        var triage = new KeywordRouterAgent("triage")
            .route("complex", "design", "implement", "refactor", "migrate", "architecture")
            .fallback("simple");

        var deepWork = new FlowOrchestrator("deep-work").inputPropagation(InputPropagation.PREVIOUS_RESULT);
        deepWork.start(FunctionAgent.of("outline", TriageFlow::outline))
                .next(FunctionAgent.of("review", TriageFlow::review));

        var answer = FunctionAgent.of("answer", input -> AgentOutput.of("Quick answer: " + input.query()));
        var report = new ReportAgent("report");

        triage.on("complex", deepWork).onDefault(report);
        triage.on("simple").to(answer).onDefault(report);

        var flow = new FlowOrchestrator("triage-flow");
        flow.start(triage);
        return flow;
    }

    static AgentOutput outline(AgentInput input) {
        var steps = new ArrayList<String>();
        for (String part : input.query().split("\\s+and\\s+|[,;]")) {
            if (!part.isBlank()) {
                steps.add((steps.size() + 1) + ". " + part.strip());
            }
        }
        return AgentOutput.routed(steps, Action.Standard.SUCCESS);
    }

    static AgentOutput review(AgentInput input) {
        Object previous = input.context().get(InputPropagation.PREVIOUS_RESULT_KEY);
        int stepCount = previous instanceof List<?> steps ? steps.size() : 0;
        int maxSteps = maxSteps(input);

        if (stepCount > maxSteps) {
            return AgentOutput.routed("Plan has %d steps, more than %d: split the request".formatted(stepCount, maxSteps),
                "too-large");
        }
        return AgentOutput.routed("Plan of %d steps approved".formatted(stepCount), "approved");
    }

    private static int maxSteps(AgentInput input) {
        String raw = input.parameter(MAX_STEPS_PARAM, null);
        if (raw == null) {
            return DEFAULT_MAX_STEPS;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + MAX_STEPS_PARAM + "' is not a number: " + raw, e);
        }
    }

    /**
     * Closes the flow with a one-line account of the path taken, read from the history.
     */
    static final class ReportAgent extends AgentNode {

        ReportAgent(String name) {
            super(name);
        }

        @Override
        protected AgentInput beforePlan(ContextStore context, AgentInput input) {
            FlowSummary summary = context.getFlowSummary();
            Object lastResult = context.lastRecord().map(r -> r.result()).orElse(null);
            return input.withContext(Map.of(
                "path", String.join(" -> ", summary.agentsVisited()),
                "lastResult", String.valueOf(lastResult)
            ));
        }

        @Override
        public PlanResult plan(AgentInput input) {
            return PlanResult.of("Report on '%s' via %s".formatted(input.query(), input.context().get("path")), input);
        }

        @Override
        public CompletableFuture<AgentOutput> run(PlanResult plan) {
            String text = "%s | %s".formatted(plan.plan(), plan.input().context().get("lastResult"));
            return CompletableFuture.completedFuture(AgentOutput.routed(text, Action.Standard.SUCCESS).withPlan(plan.plan()));
        }
    }
}
