package dev.agentflow.engine;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    @Test
    void buildPromptCombinesInstructionsQueryAndActionBlock() {
        String prompt = PromptBuilder.buildPrompt("Classify the request.", "Refactor the parser",
            Set.of("complex", "simple", "failure"));

        assertThat(prompt).startsWith("Classify the request.");
        assertThat(prompt).contains("Request:\nRefactor the parser");
        assertThat(prompt).contains("End your response with one of these JSON blocks");
        assertThat(prompt).contains("{\"action\": \"complex\"}");
        assertThat(prompt).contains("{\"action\": \"simple\"}");
        assertThat(prompt).contains("{\"action\": \"failure\", \"reason\":");
    }

    @Test
    void blankInstructionsAreOmitted() {
        String prompt = PromptBuilder.buildPrompt(null, "What time is it?", Set.of("default"));

        assertThat(prompt).startsWith("Request:\nWhat time is it?");
    }

    @Test
    void actionsAreSortedAlphabeticallyWithFailureLast() {
        String prompt = PromptBuilder.buildPrompt("Do work.", "q", Set.of("zebra", "alpha", "middle", "failure"));

        int alphaIdx = prompt.indexOf("\"alpha\"");
        int middleIdx = prompt.indexOf("\"middle\"");
        int zebraIdx = prompt.indexOf("\"zebra\"");
        int failureIdx = prompt.indexOf("\"failure\"");

        assertThat(alphaIdx).isLessThan(middleIdx);
        assertThat(middleIdx).isLessThan(zebraIdx);
        assertThat(zebraIdx).isLessThan(failureIdx);
    }

    @Test
    void reminderPromptIncludesErrorAndValidResponses() {
        String reminder = PromptBuilder.buildReminderPrompt(Set.of("complex", "simple"), "No JSON block found");

        assertThat(reminder).contains("did not include the required JSON action block");
        assertThat(reminder).contains("Error: No JSON block found");
        assertThat(reminder).contains("{\"action\": \"simple\"}");
        assertThat(reminder).doesNotContain("failure");
        assertThat(reminder).contains("Respond with ONLY the JSON block");
    }

    @Test
    void emptyActionSetAsksForAnyActionWithDefaultExample() {
        String prompt = PromptBuilder.buildPrompt(null, "q", Set.of());

        assertThat(prompt).contains("naming the next action");
        assertThat(prompt).contains("{\"action\": \"default\"}");
        assertThat(prompt).endsWith("Any other fields you add to the block are passed on to the next agent.");
    }
}
