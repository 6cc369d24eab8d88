package dev.agentflow.engine;

import org.slf4j.MDC;

/**
 * MDC keys identifying the flow and agent a log line belongs to.
 */
public final class FlowMdc {

    public static final String FLOW = "flow";
    public static final String AGENT = "agent";

    private FlowMdc() {}

    /**
     * Tag the current thread with a flow step; closing the scope restores whatever an
     * enclosing flow had set.
     */
    public static Scope step(String flow, String agent) {
        String previousFlow = MDC.get(FLOW);
        String previousAgent = MDC.get(AGENT);
        MDC.put(FLOW, flow);
        MDC.put(AGENT, agent);
        return () -> {
            restore(FLOW, previousFlow);
            restore(AGENT, previousAgent);
        };
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
