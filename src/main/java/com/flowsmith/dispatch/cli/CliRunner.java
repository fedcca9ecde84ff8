package com.flowsmith.dispatch.cli;

import com.flowsmith.FlowsmithApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code flowsmith} picocli command tree once the Spring context is up,
 * with subcommands created by the Spring-backed factory so {@code generate},
 * {@code compile} and {@code plugins} get the pipeline beans injected. The
 * picocli exit status becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final FlowsmithCommand flowsmithCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FlowsmithCommand flowsmithCommand, IFactory factory) {
        this.flowsmithCommand = flowsmithCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve is handled by the web container
        if (FlowsmithApplication.isServe(args)) {
            return;
        }
        exitCode = new CommandLine(flowsmithCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
