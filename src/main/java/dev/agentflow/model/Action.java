package dev.agentflow.model;

import java.util.Map;
import java.util.Objects;

/**
 * A routing label emitted by a node. The labels the engine and the bundled agents
 * know about form a closed set; any other label is carried as a custom action.
 */
public sealed interface Action permits Action.Standard, Action.Custom {

    /** Reserved fallback label used when a node does not route explicitly. */
    String DEFAULT_LABEL = "default";

    /** Metadata key a node sets to choose its successor. */
    String METADATA_KEY = "action";

    String label();

    enum Standard implements Action {
        DEFAULT(DEFAULT_LABEL),
        SUCCESS("success"),
        FAILURE("failure");

        private final String label;

        Standard(String label) {
            this.label = label;
        }

        @Override
        public String label() {
            return label;
        }
    }

    /** Caller-defined label such as "complex" or "needs-review". */
    record Custom(String label) implements Action {
        public Custom {
            Objects.requireNonNull(label, "Action label cannot be null");
            if (label.isBlank()) {
                throw new IllegalArgumentException("Action label cannot be blank");
            }
        }
    }

    static Action of(String label) {
        for (Standard standard : Standard.values()) {
            if (standard.label().equals(label)) {
                return standard;
            }
        }
        return new Custom(label);
    }

    /**
     * Derive the routing label from output metadata: the "action" entry verbatim when
     * present, otherwise {@value #DEFAULT_LABEL}.
     */
    static String fromMetadata(Map<String, ?> metadata) {
        if (metadata == null) {
            return DEFAULT_LABEL;
        }
        Object value = metadata.get(METADATA_KEY);
        if (value == null) {
            return DEFAULT_LABEL;
        }
        if (value instanceof Action action) {
            return action.label();
        }
        return value.toString();
    }
}
