package dev.agentflow.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.agentflow.model.Action;
import dev.agentflow.model.ActionResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the trailing JSON action block from a text response, for agents whose
 * routing decision comes from a language model.
 *
 * <p>The block must sit on one of the last few non-blank lines, either bare or wrapped
 * in a one-line code fence. Fields other than {@code action} and {@code reason} are
 * returned as-is so the agent can pass them on as output metadata.
 */
public final class ActionExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};
    private static final int TAIL_LINES = 5;
    private static final String REASON = "reason";
    private static final String FAILURE = Action.Standard.FAILURE.label();
    private static final Pattern INLINE_FENCE = Pattern.compile("^`{3}(?:json)?\\s*(\\{.*})\\s*`{3}$");

    private ActionExtractor() {}

    /**
     * Extract and validate an action from the response text.
     *
     * @param responseText   the full response
     * @param allowedActions labels the caller routes on; an empty set accepts any label
     * @return success with the action, optional reason and extra fields, or failure with error details
     */
    public static ActionResult extract(String responseText, Set<String> allowedActions) {
        if (responseText == null || responseText.isBlank()) {
            return new ActionResult.Failure("Empty response", null);
        }

        Optional<String> block = locateBlock(responseText);
        if (block.isEmpty()) {
            return new ActionResult.Failure("No JSON block found in response", null);
        }
        String candidate = block.get();

        JsonNode node;
        try {
            node = MAPPER.readTree(candidate);
        } catch (JsonProcessingException e) {
            return new ActionResult.Failure("Invalid JSON: " + e.getOriginalMessage(), candidate);
        }

        String action = text(node, Action.METADATA_KEY);
        if (action == null) {
            return new ActionResult.Failure("Missing or non-string 'action' field", candidate);
        }
        if (!allowedActions.isEmpty() && !allowedActions.contains(action)) {
            return new ActionResult.Failure(
                "Action '%s' not in allowed actions: %s".formatted(action, allowedActions), candidate);
        }

        String reason = text(node, REASON);
        if (FAILURE.equals(action) && reason == null) {
            return new ActionResult.Failure("Action 'failure' requires non-empty 'reason' field", candidate);
        }

        LinkedHashMap<String, Object> fields = MAPPER.convertValue(node, FIELDS);
        fields.remove(Action.METADATA_KEY);
        fields.remove(REASON);
        return new ActionResult.Success(action, reason, fields);
    }

    // Newest non-blank line first; a one-line fence is unwrapped.
    private static Optional<String> locateBlock(String responseText) {
        List<String> lines = responseText.lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .toList();

        for (int i = lines.size() - 1; i >= Math.max(0, lines.size() - TAIL_LINES); i--) {
            String line = lines.get(i);
            Matcher fenced = INLINE_FENCE.matcher(line);
            if (fenced.matches()) {
                return Optional.of(fenced.group(1));
            }
            if (line.startsWith("{") && line.endsWith("}")) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
