package dev.agentflow.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input handed to a node's execution: the query plus optional context, requested tools
 * and parameters.
 */
public record AgentInput(
    String query,
    Map<String, Object> context,
    List<String> tools,
    Map<String, Object> parameters
) {
    public AgentInput {
        Objects.requireNonNull(query, "query");
        context = Params.freeze(context);
        tools = tools == null ? List.of() : List.copyOf(tools);
        parameters = Params.freeze(parameters);
    }

    public static AgentInput of(String query) {
        return new AgentInput(query, null, null, null);
    }

    public static AgentInput of(String query, Map<String, ?> parameters) {
        return new AgentInput(query, null, null, Params.freeze(parameters));
    }

    public AgentInput withQuery(String newQuery) {
        return new AgentInput(newQuery, context, tools, parameters);
    }

    /** Copy with the given entries added to the context, replacing existing keys. */
    public AgentInput withContext(Map<String, ?> entries) {
        return new AgentInput(query, Params.layer(context, entries), tools, parameters);
    }

    public AgentInput withParameters(Map<String, ?> newParameters) {
        return new AgentInput(query, context, tools, Params.freeze(newParameters));
    }

    public Object parameter(String key) {
        return parameters.get(key);
    }

    public String parameter(String key, String fallback) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : fallback;
    }
}
