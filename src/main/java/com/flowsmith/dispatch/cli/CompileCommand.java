package com.flowsmith.dispatch.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.compiler.CompilationFeedback;
import com.flowsmith.core.engine.WorkflowPipelineEngine;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.ReviewDecisions;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.dispatch.api.CompileResponse;
import com.flowsmith.dispatch.api.WorkflowResponses;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: flowsmith compile --plan &lt;file&gt;
 * <p>
 * Runs stage two on the output of {@code flowsmith generate --out}, or on a
 * bare grounded plan, and prints the compiled steps.
 */
@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Formalize a grounded plan and compile workflow steps")
@Component
public class CompileCommand implements Callable<Integer> {

    @Option(names = "--plan", required = true,
            description = "Generate response JSON, or a grounded plan JSON file")
    private Path planFile;

    @Option(names = {"--prompt", "-p"}, description = "Enhanced prompt JSON file")
    private Path promptFile;

    @Option(names = {"--decisions", "-d"}, description = "Review decisions JSON file")
    private Path decisionsFile;

    @Option(names = {"--feedback", "-f"}, description = "Feedback on a previous generation; uses the LLM compiler")
    private String feedback;

    @Option(names = {"--user", "-u"}, description = "User id", defaultValue = "cli")
    private String userId;

    @Option(names = {"--out", "-o"}, description = "Write the full response JSON here")
    private Path outFile;

    private final WorkflowPipelineEngine engine;

    public CompileCommand(WorkflowPipelineEngine engine) {
        this.engine = engine;
    }

    /**
     * Accepts either a full generate response or a bare grounded plan.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlanFile(@JsonProperty("grounded_plan") GroundedSemanticPlan groundedPlan) {}

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        CompilationState state;
        try {
            GroundedSemanticPlan plan = JsonFiles.read(planFile, PlanFile.class).groundedPlan();
            if (plan == null) {
                plan = JsonFiles.read(planFile, GroundedSemanticPlan.class);
            }
            EnhancedPrompt prompt = promptFile == null ? null : JsonFiles.read(promptFile, EnhancedPrompt.class);
            ReviewDecisions decisions = decisionsFile == null ? ReviewDecisions.none()
                    : JsonFiles.read(decisionsFile, ReviewDecisions.class);
            CompilationFeedback compilationFeedback = feedback == null ? null
                    : new CompilationFeedback(List.of(), feedback, List.of(), 1);
            ConsoleOutput.info("Formalizing and compiling...");
            state = engine.compile(engine.generateRequestId(), userId, plan, prompt, decisions, compilationFeedback);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Compilation failed: " + e.getMessage());
            return 1;
        }

        if (state.hasErrors()) {
            ConsoleOutput.pipelineErrors(state.errors());
            if (outFile != null) {
                JsonFiles.write(outFile, WorkflowResponses.failed(state));
            }
            return 1;
        }

        CompileResponse response = WorkflowResponses.compiled(state);
        ConsoleOutput.info("Compiler: " + response.metadata().compilerUsed()
                + (response.metadata().fallbackReason() != null
                        ? " (fallback: " + response.metadata().fallbackReason() + ")" : ""));
        System.out.println("STEPS:");
        ConsoleOutput.steps(response.workflow());
        if (response.validation() != null) {
            response.validation().errors().forEach(ConsoleOutput::error);
            response.validation().warnings().forEach(ConsoleOutput::warn);
        }
        ConsoleOutput.phaseTimes(response.metadata().phaseTimesMs());
        if (outFile != null) {
            JsonFiles.write(outFile, response);
            ConsoleOutput.info("Response written to " + outFile);
        }
        if (response.success()) {
            ConsoleOutput.success(response.workflow().size() + " steps compiled");
            return 0;
        }
        ConsoleOutput.error("Workflow failed validation");
        return 1;
    }
}
