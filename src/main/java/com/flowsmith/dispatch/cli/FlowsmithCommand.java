package com.flowsmith.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Flowsmith.
 * Routes to subcommands: generate, compile, plugins, serve.
 */
@Command(
        name = "flowsmith",
        mixinStandardHelpOptions = true,
        version = "Flowsmith 0.1.0",
        description = "Turns natural-language automation requests into executable workflows",
        subcommands = {
                GenerateCommand.class,
                CompileCommand.class,
                PluginsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FlowsmithCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
