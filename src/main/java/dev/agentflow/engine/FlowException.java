package dev.agentflow.engine;

/**
 * Raised for engine-level failures: a flow without a start node, a node that returns
 * no result future, or a checked cause surfacing through the blocking API.
 * Failures raised by a node itself are never wrapped in this type.
 */
public class FlowException extends RuntimeException {

    public FlowException(String message) {
        super(message);
    }

    public FlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
