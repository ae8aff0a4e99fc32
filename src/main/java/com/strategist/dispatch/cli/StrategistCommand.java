package com.strategist.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: plan, profiles, templates, serve.
 */
@Command(
        name = "strategist",
        mixinStandardHelpOptions = true,
        version = "Strategist 0.1.0",
        description = "Deterministic project planner: phases, task graphs and resourced mission maps",
        subcommands = {
                PlanCommand.class,
                ProfilesCommand.class,
                TemplatesCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StrategistCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
