package dev.agentflow.engine;

import dev.agentflow.model.Action;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds prompts that ask a model to finish its answer with a JSON action block.
 * The allowed actions are listed as example blocks, alphabetically, with
 * {@code failure} last since it needs a reason.
 */
public final class PromptBuilder {

    private static final String FAILURE = Action.Standard.FAILURE.label();
    private static final Comparator<String> FAILURE_LAST =
        Comparator.comparing((String action) -> action.equals(FAILURE)).thenComparing(Comparator.naturalOrder());

    private PromptBuilder() {}

    public static String buildPrompt(String instructions, String query, Set<String> actions) {
        var sb = new StringBuilder();
        if (instructions != null && !instructions.isBlank()) {
            sb.append(instructions.strip()).append("\n\n");
        }
        sb.append("Request:\n").append(query).append("\n\n");
        if (actions.isEmpty()) {
            sb.append("End your response with a JSON block naming the next action on the last line, for example:\n\n");
            sb.append(example(Action.DEFAULT_LABEL));
        } else {
            sb.append("End your response with one of these JSON blocks on the last line:\n\n");
            sb.append(examples(actions));
        }
        sb.append("\n\nAny other fields you add to the block are passed on to the next agent.");
        return sb.toString();
    }

    /**
     * Follow-up prompt sent when the previous response carried no usable action block.
     */
    public static String buildReminderPrompt(Set<String> actions, String errorDetails) {
        return "Your previous response did not include the required JSON action block.\n"
            + "Please respond now with ONLY the JSON action on a single line.\n\n"
            + "Error: " + errorDetails + "\n\n"
            + "Valid responses:\n\n"
            + (actions.isEmpty() ? example(Action.DEFAULT_LABEL) : examples(actions))
            + "\n\nRespond with ONLY the JSON block, nothing else.";
    }

    private static String examples(Set<String> actions) {
        return actions.stream()
            .sorted(FAILURE_LAST)
            .map(PromptBuilder::example)
            .collect(Collectors.joining("\n"));
    }

    private static String example(String action) {
        if (FAILURE.equals(action)) {
            return "{\"action\": \"failure\", \"reason\": \"<brief description>\"}";
        }
        return "{\"action\": \"%s\"}".formatted(action);
    }
}
