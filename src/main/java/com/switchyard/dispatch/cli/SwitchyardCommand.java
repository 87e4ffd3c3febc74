package com.switchyard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Switchyard.
 * Routes to subcommands: route, status, health, serve.
 */
@Command(
        name = "switchyard",
        mixinStandardHelpOptions = true,
        version = "Switchyard 0.1.0",
        description = "Request routing, channel queues and circuit breakers for domain agents",
        subcommands = {
                RouteCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchyardCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
