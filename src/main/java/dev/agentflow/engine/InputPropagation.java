package dev.agentflow.engine;

import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;

import java.util.LinkedHashMap;

/**
 * What input the orchestrator hands to each node after the first.
 */
public enum InputPropagation {

    /** Every node receives the flow's original input. */
    ORIGINAL_INPUT {
        @Override
        AgentInput nextInput(AgentInput original, AgentInput current, String agentName,
                             String action, AgentOutput output) {
            return original;
        }
    },

    /**
     * Each node receives the previous node's result as its query, with the previous
     * agent, action and raw result added to the context.
     */
    PREVIOUS_RESULT {
        @Override
        AgentInput nextInput(AgentInput original, AgentInput current, String agentName,
                             String action, AgentOutput output) {
            var previous = new LinkedHashMap<String, Object>();
            previous.put(PREVIOUS_AGENT, agentName);
            previous.put(PREVIOUS_ACTION, action);
            previous.put(PREVIOUS_RESULT_KEY, output.result());
            return current.withQuery(String.valueOf(output.result())).withContext(previous);
        }
    };

    public static final String PREVIOUS_AGENT = "previousAgent";
    public static final String PREVIOUS_ACTION = "previousAction";
    public static final String PREVIOUS_RESULT_KEY = "previousResult";

    abstract AgentInput nextInput(AgentInput original, AgentInput current, String agentName,
                                  String action, AgentOutput output);
}
