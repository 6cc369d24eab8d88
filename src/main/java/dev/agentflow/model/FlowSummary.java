package dev.agentflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over a context's history.
 */
public record FlowSummary(
    int totalSteps,
    String currentAgent, // nullable — no step recorded yet
    List<String> branchDecisions,
    List<String> agentsVisited,
    Map<String, Integer> visitCounts, // first-visit order
    Instant startedAt
) {
    public FlowSummary {
        branchDecisions = List.copyOf(branchDecisions);
        agentsVisited = List.copyOf(agentsVisited);
        visitCounts = Collections.unmodifiableMap(new LinkedHashMap<>(visitCounts));
    }

    public int distinctAgents() {
        return agentsVisited.size();
    }
}
