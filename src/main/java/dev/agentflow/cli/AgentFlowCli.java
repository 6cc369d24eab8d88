package dev.agentflow.cli;

import ch.qos.logback.classic.Level;
import dev.agentflow.engine.ContextStore;
import dev.agentflow.engine.FlowOrchestrator;
import dev.agentflow.engine.InputPropagation;
import dev.agentflow.model.AgentInput;
import dev.agentflow.model.AgentOutput;
import dev.agentflow.model.FlowRecord;
import dev.agentflow.model.FlowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point: runs the built-in triage flow on a request.
 */
@Command(
    name = "agent-flow",
    mixinStandardHelpOptions = true,
    description = "Route a request through a graph of agents and report the path taken."
)
public class AgentFlowCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AgentFlowCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "QUERY", description = "Request to run through the flow")
    private String query;

    @Option(names = "--param", description = "Flow-level parameter, key=value (repeatable)")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(names = "--chain-results", description = "Pass each node's result to the next node as its input")
    private boolean chainResults;

    @Option(names = "--dry-run", description = "Print the flow topology without executing")
    private boolean dryRun;

    @Option(names = "--json", description = "Print the run report as JSON")
    private boolean json;

    @Option(names = "--verbose", description = "Log orchestration steps")
    private boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (verbose) {
            enableVerboseLogging();
        }

        FlowOrchestrator flow = TriageFlow.build();
        if (chainResults) {
            flow.inputPropagation(InputPropagation.PREVIOUS_RESULT);
        }

        if (dryRun) {
            out.println("Flow '" + flow.name() + "':");
            out.print(flow.graph().describe());
            out.flush();
            return 0;
        }

        if (query == null || query.isBlank()) {
            err.println("Error: a request is required. Use --dry-run to inspect the flow.");
            return 1;
        }

        var context = new ContextStore(params);
        AgentOutput output;
        try {
            output = flow.run(context, AgentInput.of(query));
        } catch (RuntimeException e) {
            log.debug("Flow '{}' failed", flow.name(), e);
            err.println("Flow failed: " + e.getMessage());
            printHistory(err, context);
            return 1;
        }

        if (json) {
            out.println(FlowReportWriter.render(context, output));
        } else {
            out.println("Result: " + output.result());
            printHistory(out, context);
        }
        out.flush();
        return 0;
    }

    private static void printHistory(PrintWriter out, ContextStore context) {
        FlowSummary summary = context.getFlowSummary();
        out.println("Steps: " + summary.totalSteps() + " (" + summary.distinctAgents() + " agents)");
        int i = 1;
        for (FlowRecord record : context.flowHistory()) {
            out.println("  " + i++ + ". " + record.agentName() + " -> " + record.action());
        }
        out.flush();
    }

    private static void enableVerboseLogging() {
        Logger root = LoggerFactory.getLogger("dev.agentflow");
        if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
