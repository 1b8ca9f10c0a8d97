package com.acme.relay.cli.commands;

import com.acme.relay.cli.config.RelayConfiguration;
import com.acme.relay.core.Jsons;
import com.acme.relay.counters.ActivityCounters;
import com.acme.relay.counters.PersistentCounters;
import com.acme.relay.scheduler.ExecutorScheduler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "stats", description = "Show the persisted activity counters")
public class StatsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--file"}, description = "Counters file (default: RELAY_STATE_FILE or ./bot-state.json)")
    private Path file;

    @Option(names = {"-e", "--env-dir"}, description = "Directory containing the .env file (default: working directory)")
    private Path envDir;

    @Option(names = {"--format"}, description = "Output format: table or json (default: table)", defaultValue = "table")
    private String format;

    @Override
    public Integer call() {
        Path counterFile = file != null
                ? file
                : RelayConfiguration.load(envDir).toRelayConfig().getStateFile();
        PrintWriter out = spec.commandLine().getOut();
        if (!Files.exists(counterFile)) {
            out.println("No counters file found at " + counterFile);
            return 0;
        }

        ExecutorScheduler scheduler = new ExecutorScheduler();
        try {
            ActivityCounters counters = new PersistentCounters(counterFile, scheduler).load();
            if ("json".equalsIgnoreCase(format)) {
                out.println(Jsons.toPrettyJson(counters));
            } else {
                printTable(out, counters);
            }
        } finally {
            scheduler.shutdown();
        }
        out.flush();
        return 0;
    }

    private void printTable(PrintWriter out, ActivityCounters counters) {
        out.printf("%-20s %s%n", "Messages relayed:", counters.getMessagesRelayed());
        out.printf("%-20s %s%n", "Errors encountered:", counters.getErrorsEncountered());
        out.printf("%-20s %s%n", "Last message at:", orDash(counters.getLastMessageAt()));
        out.printf("%-20s %s%n", "Started at:", orDash(counters.getStartedAt()));
        out.printf("%-20s %s%n", "Last saved at:", orDash(counters.getLastPersistedAt()));
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
