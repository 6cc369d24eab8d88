package dev.agentflow.backend;

/**
 * Structured response from a completion backend.
 */
public record CompletionResponse(
    boolean success,
    String text,
    String error,
    Long inputTokens,
    Long outputTokens
) {
    public static CompletionResponse success(String text) {
        return new CompletionResponse(true, text, null, null, null);
    }

    public static CompletionResponse failure(String error) {
        return new CompletionResponse(false, null, error, null, null);
    }
}
