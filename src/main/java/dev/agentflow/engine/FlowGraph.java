package dev.agentflow.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable snapshot of the topology reachable from a start node. Nodes are stored
 * in discovery order and addressed by integer handle; the start node is handle 0.
 *
 * <p>Nodes are identified by reference, so two distinct nodes sharing a name get two
 * handles. A sub-flow is a single node here: its inner graph is not expanded.
 */
public final class FlowGraph {

    private final List<FlowNode> nodes;
    private final List<Map<String, Integer>> edges;

    private FlowGraph(List<FlowNode> nodes, List<Map<String, Integer>> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    public static FlowGraph of(FlowNode start) {
        Objects.requireNonNull(start, "start");

        var handles = new IdentityHashMap<FlowNode, Integer>();
        var nodes = new ArrayList<FlowNode>();
        var edges = new ArrayList<Map<String, Integer>>();
        handles.put(start, 0);
        nodes.add(start);

        // nodes doubles as the work queue; cycles stop at already assigned handles
        for (int i = 0; i < nodes.size(); i++) {
            var out = new LinkedHashMap<String, Integer>();
            for (var edge : nodes.get(i).successors().asMap().entrySet()) {
                FlowNode target = edge.getValue();
                Integer handle = handles.get(target);
                if (handle == null) {
                    handle = nodes.size();
                    handles.put(target, handle);
                    nodes.add(target);
                }
                out.put(edge.getKey(), handle);
            }
            edges.add(Collections.unmodifiableMap(out));
        }
        return new FlowGraph(List.copyOf(nodes), List.copyOf(edges));
    }

    public int start() {
        return 0;
    }

    public int size() {
        return nodes.size();
    }

    public FlowNode node(int handle) {
        return nodes.get(handle);
    }

    public Map<String, Integer> edges(int handle) {
        return edges.get(handle);
    }

    /** Same resolution rule as {@link Successors#resolve}: exact, then default, then none. */
    public OptionalInt next(int handle, String action) {
        Integer target = Successors.pick(edges.get(handle), action);
        return target != null ? OptionalInt.of(target) : OptionalInt.empty();
    }

    /**
     * One line per node, e.g. {@code [0] triage: complex -> [1] deep-work, simple -> [2] answer}.
     */
    public String describe() {
        var sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            FlowNode node = nodes.get(i);
            sb.append('[').append(i).append("] ").append(node.name());
            if (node instanceof FlowOrchestrator) {
                sb.append(" (sub-flow)");
            }
            Map<String, Integer> out = edges.get(i);
            if (out.isEmpty()) {
                sb.append(": end");
            } else {
                sb.append(": ");
                boolean first = true;
                for (var edge : out.entrySet()) {
                    if (!first) {
                        sb.append(", ");
                    }
                    sb.append(edge.getKey()).append(" -> [").append(edge.getValue()).append("] ")
                      .append(nodes.get(edge.getValue()).name());
                    first = false;
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
