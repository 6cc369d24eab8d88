package dev.agentflow;

import dev.agentflow.cli.AgentFlowCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AgentFlowCli()).execute(args);
        System.exit(exitCode);
    }
}
