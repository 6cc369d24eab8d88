package dev.agentflow.engine;

import dev.agentflow.model.Action;
import dev.agentflow.model.FlowRecord;
import dev.agentflow.model.FlowSummary;
import dev.agentflow.model.Params;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable execution record shared by every node of one flow invocation.
 * Not thread-safe: use one store per concurrent invocation.
 */
public final class ContextStore {

    private final List<FlowRecord> flowHistory = new ArrayList<>();
    private final List<String> branchDecisions = new ArrayList<>();
    private String currentAgent;
    private Map<String, Object> flowParams = Map.of();
    private Instant startedAt = Instant.now();

    public ContextStore() {}

    public ContextStore(Map<String, ?> flowParams) {
        this.flowParams = Params.freeze(flowParams);
    }

    public FlowRecord recordFlowStep(String agentName, String action, Object result) {
        return recordFlowStep(agentName, action, result, null);
    }

    /**
     * Append a record for an executed node. A null action is recorded as "default".
     */
    public FlowRecord recordFlowStep(String agentName, String action, Object result, Map<String, ?> metadata) {
        Objects.requireNonNull(agentName, "agentName");
        String decision = action != null ? action : Action.DEFAULT_LABEL;

        FlowRecord record = FlowRecord.of(agentName, decision, result, metadata);
        flowHistory.add(record);
        branchDecisions.add(decision);
        currentAgent = agentName;
        return record;
    }

    public FlowSummary getFlowSummary() {
        var visitCounts = new LinkedHashMap<String, Integer>();
        for (FlowRecord record : flowHistory) {
            visitCounts.merge(record.agentName(), 1, Integer::sum);
        }
        return new FlowSummary(
            flowHistory.size(),
            currentAgent,
            branchDecisions,
            new ArrayList<>(visitCounts.keySet()),
            visitCounts,
            startedAt
        );
    }

    /**
     * Forget the recorded run. Flow-level parameters are kept.
     */
    public void resetFlow() {
        flowHistory.clear();
        branchDecisions.clear();
        currentAgent = null;
        startedAt = Instant.now();
    }

    public ContextStore setFlowParams(Map<String, ?> params) {
        this.flowParams = Params.freeze(params);
        return this;
    }

    public Map<String, Object> flowParams() {
        return flowParams;
    }

    public List<FlowRecord> flowHistory() {
        return List.copyOf(flowHistory);
    }

    public List<String> branchDecisions() {
        return List.copyOf(branchDecisions);
    }

    public Optional<String> currentAgent() {
        return Optional.ofNullable(currentAgent);
    }

    public Optional<FlowRecord> lastRecord() {
        return flowHistory.isEmpty()
            ? Optional.empty()
            : Optional.of(flowHistory.get(flowHistory.size() - 1));
    }

    public int visitCount(String agentName) {
        int count = 0;
        for (FlowRecord record : flowHistory) {
            if (record.agentName().equals(agentName)) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return flowHistory.size();
    }

    public Instant startedAt() {
        return startedAt;
    }
}
