package dev.agentflow.engine;

import dev.agentflow.model.ActionResult;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ActionExtractorTest {

    private static final Set<String> TRIAGE_ACTIONS = Set.of("complex", "simple", "failure");

    @Test
    void extractsActionFromLastLine() {
        String response = """
            This needs a design discussion first.

            {"action": "complex"}""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Success.class);
        var success = (ActionResult.Success) result;
        assertThat(success.action()).isEqualTo("complex");
        assertThat(success.reason()).isNull();
    }

    @Test
    void extractsActionFromWithinLastFiveLines() {
        String response = """
            Straightforward lookup.

            {"action": "simple"}

            """;

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Success.class);
        assertThat(((ActionResult.Success) result).action()).isEqualTo("simple");
    }

    @Test
    void extractsFailureWithReason() {
        String response = """
            I cannot read that file.

            {"action": "failure", "reason": "File is not readable"}""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Success.class);
        var success = (ActionResult.Success) result;
        assertThat(success.action()).isEqualTo("failure");
        assertThat(success.reason()).isEqualTo("File is not readable");
    }

    @Test
    void failsWhenFailureMissingReason() {
        String response = """
            Something went wrong.
            {"action": "failure"}""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Failure.class);
        assertThat(((ActionResult.Failure) result).error()).contains("reason");
    }

    @Test
    void failsWhenNoJsonBlockFound() {
        String response = "It is a simple question, the answer is 4.";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Failure.class);
        assertThat(((ActionResult.Failure) result).error()).contains("No JSON block found");
    }

    @Test
    void failsOnEmptyResponse() {
        assertThat(ActionExtractor.extract("  ", TRIAGE_ACTIONS)).isInstanceOf(ActionResult.Failure.class);
        assertThat(ActionExtractor.extract(null, TRIAGE_ACTIONS)).isInstanceOf(ActionResult.Failure.class);
    }

    @Test
    void failsWhenActionNotAllowed() {
        String response = """
            Done.
            {"action": "escalate"}""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Failure.class);
        var failure = (ActionResult.Failure) result;
        assertThat(failure.error()).contains("not in allowed actions");
        assertThat(failure.malformedJson()).isEqualTo("{\"action\": \"escalate\"}");
    }

    @Test
    void emptyAllowedSetAcceptsAnyAction() {
        var result = ActionExtractor.extract("{\"action\": \"escalate\"}", Set.of());

        assertThat(result).isEqualTo(new ActionResult.Success("escalate", null));
    }

    @Test
    void failsWhenActionIsNotAString() {
        var result = ActionExtractor.extract("{\"action\": 3}", TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Failure.class);
        assertThat(((ActionResult.Failure) result).error()).contains("'action'");
    }

    @Test
    void handlesJsonOnLineWithSurroundingFences() {
        String response = """
            Triage complete.
            ```json
            {"action": "simple"}
            ```""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Success.class);
        assertThat(((ActionResult.Success) result).action()).isEqualTo("simple");
    }

    @Test
    void failsOnMalformedJson() {
        String response = """
            Done.
            {"action": simple}""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Failure.class);
        assertThat(((ActionResult.Failure) result).error()).startsWith("Invalid JSON");
    }

    @Test
    void ignoresJsonBeyondLastFiveLines() {
        String response = """
            {"action": "simple"}
            line 1
            line 2
            line 3
            line 4
            line 5""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Failure.class);
        assertThat(((ActionResult.Failure) result).error()).contains("No JSON block found");
    }

    @Test
    void returnsExtraFieldsInBlockOrder() {
        String response = """
            Needs a migration plan.
            {"action": "complex", "reason": "schema change", "priority": "high", "estimate": 3}""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isInstanceOf(ActionResult.Success.class);
        var success = (ActionResult.Success) result;
        assertThat(success.reason()).isEqualTo("schema change");
        assertThat(success.fields()).containsExactly(entry("priority", "high"), entry("estimate", 3));
    }

    @Test
    void unwrapsBlockFencedOnOneLine() {
        String response = """
            Quick one.
            ```json {"action": "simple"} ```""";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isEqualTo(new ActionResult.Success("simple", null));
    }

    @Test
    void blankLinesDoNotCountTowardsTail() {
        String response = "{\"action\": \"simple\"}\n\n\n\n\n\n\nThat is all.";

        var result = ActionExtractor.extract(response, TRIAGE_ACTIONS);

        assertThat(result).isEqualTo(new ActionResult.Success("simple", null));
    }
}
