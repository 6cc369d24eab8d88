package dev.agentflow.agents;

import dev.agentflow.backend.CompletionBackend;
import dev.agentflow.backend.CompletionRequest;
import dev.agentflow.engine.ActionExtractor;
import dev.agentflow.engine.AgentNode;
import dev.agentflow.engine.PromptBuilder;
import dev.agentflow.model.Action;
import dev.agentflow.model.ActionResult;
import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.PlanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Agent backed by a text-completion model. The model is asked to end its answer with
 * a JSON action block naming one of the allowed actions, which becomes the routing
 * action.
 *
 * <p>Other fields of the block are copied into the output metadata but never replace
 * the {@code action}, {@code reason} or {@code reminders} entries.
 *
 * <p>A response without a usable block is followed up with a reminder prompt, up to
 * {@link #maxReminders(int)} times. Backend errors and exhausted reminders produce a
 * {@code failure} action with an {@code error} entry instead of an exception, so the
 * flow can branch on them. A failed backend future is not caught.
 */
public class PromptAgent extends AgentNode {

    private static final Logger log = LoggerFactory.getLogger(PromptAgent.class);

    public static final String ERROR_KEY = "error";
    public static final String REASON_KEY = "reason";
    public static final String REMINDERS_KEY = "reminders";
    public static final String BACKEND_KEY = "backend";

    private final CompletionBackend backend;
    private final String instructions;
    private final Set<String> actions;
    private int maxReminders = 1;
    private String model;
    private String systemPrompt;

    public PromptAgent(String name, CompletionBackend backend, String instructions, Set<String> actions) {
        super(name);
        this.backend = Objects.requireNonNull(backend, "backend");
        this.instructions = instructions;
        this.actions = Set.copyOf(actions);
    }

    public PromptAgent maxReminders(int maxReminders) {
        if (maxReminders < 0) {
            throw new IllegalArgumentException("maxReminders must be >= 0, got " + maxReminders);
        }
        this.maxReminders = maxReminders;
        return this;
    }

    public PromptAgent model(String model) {
        this.model = model;
        return this;
    }

    public PromptAgent systemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
        return this;
    }

    public Set<String> actions() {
        return actions;
    }

    @Override
    public PlanResult plan(AgentInput input) {
        String prompt = PromptBuilder.buildPrompt(instructions, input.query(), actions);
        return new PlanResult(prompt, input, input.tools(), input.parameters(),
            Map.of(BACKEND_KEY, backend.getName()));
    }

    @Override
    public CompletableFuture<AgentOutput> run(PlanResult plan) {
        return attempt(plan, plan.plan(), 0);
    }

    private CompletableFuture<AgentOutput> attempt(PlanResult plan, String prompt, int reminders) {
        var request = new CompletionRequest(prompt, systemPrompt, model, plan.parameters());

        return backend.complete(request).thenCompose(response -> {
            if (!response.success()) {
                log.debug("Agent '{}': backend '{}' failed: {}", name(), backend.getName(), response.error());
                return CompletableFuture.completedFuture(
                    failure(plan, "Backend '%s' failed: %s".formatted(backend.getName(), response.error()), null, reminders));
            }

            ActionResult extracted = ActionExtractor.extract(response.text(), actions);
            if (extracted instanceof ActionResult.Success success) {
                var metadata = new LinkedHashMap<String, Object>(success.fields());
                metadata.put(Action.METADATA_KEY, success.action());
                if (success.reason() != null) {
                    metadata.put(REASON_KEY, success.reason());
                }
                metadata.put(REMINDERS_KEY, reminders);
                return CompletableFuture.completedFuture(
                    new AgentOutput(response.text(), plan.plan(), List.of(), metadata));
            }

            String error = ((ActionResult.Failure) extracted).error();
            if (reminders < maxReminders) {
                log.debug("Agent '{}': no usable action block ({}), sending reminder {}/{}",
                    name(), error, reminders + 1, maxReminders);
                return attempt(plan, PromptBuilder.buildReminderPrompt(actions, error), reminders + 1);
            }
            return CompletableFuture.completedFuture(failure(plan, error, response.text(), reminders));
        });
    }

    private static AgentOutput failure(PlanResult plan, String error, String text, int reminders) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(Action.METADATA_KEY, Action.Standard.FAILURE.label());
        metadata.put(ERROR_KEY, error);
        metadata.put(REMINDERS_KEY, reminders);
        return new AgentOutput(text, plan.plan(), List.of(), metadata);
    }
}
