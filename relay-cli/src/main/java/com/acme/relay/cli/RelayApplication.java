package com.acme.relay.cli;

import com.acme.relay.cli.commands.RunCommand;
import com.acme.relay.cli.commands.StatsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "message-relay",
        description = "Relays messages between two endpoints with a provenance prefix",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                RunCommand.class,
                StatsCommand.class
        }
)
public class RelayApplication implements Runnable {

    public static void main(String[] args) {
        // Without a subcommand the relay runs
        String[] effective = args.length == 0 ? new String[] {"run"} : args;
        int exitCode = new CommandLine(new RelayApplication()).execute(effective);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
