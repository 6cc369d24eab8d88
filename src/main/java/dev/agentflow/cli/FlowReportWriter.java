package dev.agentflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.agentflow.engine.ContextStore;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.FlowRecord;
import dev.agentflow.model.FlowSummary;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders a finished run (final output, summary and history) as JSON.
 */
public final class FlowReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowReportWriter() {}

    public static ObjectNode toJson(ContextStore context, AgentOutput output) {
        ObjectNode root = MAPPER.createObjectNode();
        if (output != null) {
            root.set("result", valueNode(output.result()));
            root.put("action", output.action());
        }

        FlowSummary summary = context.getFlowSummary();
        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("totalSteps", summary.totalSteps());
        summaryNode.put("currentAgent", summary.currentAgent());
        summaryNode.put("distinctAgents", summary.distinctAgents());
        ArrayNode decisions = summaryNode.putArray("branchDecisions");
        summary.branchDecisions().forEach(decisions::add);
        ArrayNode visited = summaryNode.putArray("agentsVisited");
        summary.agentsVisited().forEach(visited::add);
        ObjectNode counts = summaryNode.putObject("visitCounts");
        summary.visitCounts().forEach((agent, count) -> counts.put(agent, count.intValue()));

        ArrayNode history = root.putArray("history");
        for (FlowRecord record : context.flowHistory()) {
            ObjectNode entry = history.addObject();
            entry.put("agent", record.agentName());
            entry.put("action", record.action());
            entry.set("result", valueNode(record.result()));
            entry.set("metadata", metadataNode(record.metadata()));
            entry.put("recordedAt", record.recordedAt().toString());
        }
        return root;
    }

    public static String render(ContextStore context, AgentOutput output) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(context, output));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render flow report", e);
        }
    }

    private static JsonNode metadataNode(Map<String, Object> metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        metadata.forEach((key, value) -> node.set(key, valueNode(value)));
        return node;
    }

    // Results are opaque to the engine: anything Jackson cannot map is written as text
    private static JsonNode valueNode(Object value) {
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(value));
        }
    }
}
