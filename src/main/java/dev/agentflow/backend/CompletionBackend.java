package dev.agentflow.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over text-completion providers (hosted model APIs, local model servers).
 */
public interface CompletionBackend {

    /**
     * Send a prompt and return the provider's answer.
     *
     * <p>Provider-level problems the caller can route on (rate limits, refusals) should
     * come back as an unsuccessful {@link CompletionResponse}. A failed future is
     * treated as a failure of the calling agent.
     */
    CompletableFuture<CompletionResponse> complete(CompletionRequest request);

    /** Get backend display name. */
    String getName();
}
