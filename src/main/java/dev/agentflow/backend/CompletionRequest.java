package dev.agentflow.backend;

import dev.agentflow.model.Params;

import java.util.Map;
import java.util.Objects;

/**
 * A single prompt sent to a completion backend.
 */
public record CompletionRequest(
    String prompt,
    String systemPrompt, // nullable — backend default
    String model, // nullable — backend default
    Map<String, Object> parameters
) {
    public CompletionRequest {
        Objects.requireNonNull(prompt, "prompt");
        parameters = Params.freeze(parameters);
    }
}
