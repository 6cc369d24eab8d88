package dev.agentflow.agents;

import dev.agentflow.engine.AgentNode;
import dev.agentflow.model.Action;
import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.PlanResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Routes on keywords found in the query. Rules are checked in registration order and
 * the first rule with a matching keyword decides the action; with no match the
 * fallback action is emitted. The query is passed through as the result.
 */
public class KeywordRouterAgent extends AgentNode {

    public static final String KEYWORD_KEY = "keyword";

    private final Map<String, List<String>> rules = new LinkedHashMap<>();
    private String fallbackAction = Action.DEFAULT_LABEL;

    public KeywordRouterAgent(String name) {
        super(name);
    }

    public KeywordRouterAgent route(String action, String... keywords) {
        Objects.requireNonNull(action, "action");
        var lowered = new ArrayList<String>();
        for (String keyword : keywords) {
            lowered.add(keyword.toLowerCase(Locale.ROOT));
        }
        rules.computeIfAbsent(action, k -> new ArrayList<>()).addAll(lowered);
        return this;
    }

    public KeywordRouterAgent fallback(String action) {
        this.fallbackAction = Objects.requireNonNull(action, "action");
        return this;
    }

    @Override
    public PlanResult plan(AgentInput input) {
        String query = input.query().toLowerCase(Locale.ROOT);
        var metadata = new LinkedHashMap<String, Object>();

        for (var rule : rules.entrySet()) {
            for (String keyword : rule.getValue()) {
                if (query.contains(keyword)) {
                    metadata.put(Action.METADATA_KEY, rule.getKey());
                    metadata.put(KEYWORD_KEY, keyword);
                    return new PlanResult("Route to '%s' (matched '%s')".formatted(rule.getKey(), keyword),
                        input, input.tools(), input.parameters(), metadata);
                }
            }
        }

        metadata.put(Action.METADATA_KEY, fallbackAction);
        return new PlanResult("Route to '%s' (no keyword matched)".formatted(fallbackAction),
            input, input.tools(), input.parameters(), metadata);
    }

    @Override
    public CompletableFuture<AgentOutput> run(PlanResult plan) {
        return CompletableFuture.completedFuture(
            new AgentOutput(plan.input().query(), plan.plan(), List.of(), plan.metadata()));
    }
}
