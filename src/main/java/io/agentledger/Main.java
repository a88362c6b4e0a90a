package io.agentledger;

import io.agentledger.cli.AgentLedgerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentLedgerCommand()).execute(args);
        System.exit(code);
    }
}
