package dev.agentflow.engine;

import dev.agentflow.model.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outgoing edges of a node: an insertion-ordered map from action label to successor.
 */
public final class Successors {

    private static final Logger log = LoggerFactory.getLogger(Successors.class);

    private final String owner;
    private final Map<String, FlowNode> byAction = new LinkedHashMap<>();

    public Successors(String owner) {
        this.owner = owner;
    }

    /**
     * Register {@code node} as the successor for {@code action}, replacing any
     * successor previously registered under the same label.
     */
    public void register(String action, FlowNode node) {
        Objects.requireNonNull(node, "Successor node cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");

        FlowNode previous = byAction.put(action, node);
        if (previous != null && previous != node) {
            log.warn("Overwriting successor for action '{}' in node '{}': '{}' replaced by '{}'",
                action, owner, previous.name(), node.name());
        }
    }

    /**
     * Exact match on the action, then the "default" successor, then nothing.
     * Nothing is a normal end of traversal, not an error.
     */
    public Optional<FlowNode> resolve(String action) {
        return Optional.ofNullable(pick(byAction, action));
    }

    public Map<String, FlowNode> asMap() {
        return Collections.unmodifiableMap(byAction);
    }

    public boolean isEmpty() {
        return byAction.isEmpty();
    }

    public int size() {
        return byAction.size();
    }

    static <V> V pick(Map<String, V> edges, String action) {
        String key = action != null ? action : Action.DEFAULT_LABEL;
        V target = edges.get(key);
        if (target == null) {
            target = edges.get(Action.DEFAULT_LABEL);
        }
        return target;
    }
}
