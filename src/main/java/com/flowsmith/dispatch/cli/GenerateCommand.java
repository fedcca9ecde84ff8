package com.flowsmith.dispatch.cli;

import com.flowsmith.core.engine.WorkflowPipelineEngine;
import com.flowsmith.core.llm.LlmService;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.state.GenerationState;
import com.flowsmith.dispatch.api.GenerateResponse;
import com.flowsmith.dispatch.api.WorkflowResponses;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: flowsmith generate --prompt &lt;file&gt;
 * <p>
 * Runs stage one and prints the review summary. With {@code --out} the full
 * response is written for a later {@code flowsmith compile --plan}.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Understand and ground an enhanced prompt")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Option(names = {"--prompt", "-p"}, required = true, description = "Enhanced prompt JSON file")
    private Path promptFile;

    @Option(names = "--metadata", description = "Data source metadata JSON file")
    private Path metadataFile;

    @Option(names = {"--user", "-u"}, description = "User id", defaultValue = "cli")
    private String userId;

    @Option(names = "--fail-fast", description = "Stop on the first critical grounding failure")
    private boolean failFast;

    @Option(names = "--skip-grounding", description = "Skip grounding entirely")
    private boolean skipGrounding;

    @Option(names = {"--out", "-o"}, description = "Write the full response JSON here")
    private Path outFile;

    private final WorkflowPipelineEngine engine;
    private final LlmService llmService;

    public GenerateCommand(WorkflowPipelineEngine engine, LlmService llmService) {
        this.engine = engine;
        this.llmService = llmService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        GenerationState state;
        try {
            EnhancedPrompt prompt = JsonFiles.read(promptFile, EnhancedPrompt.class);
            DataSourceMetadata metadata = metadataFile == null ? null
                    : JsonFiles.read(metadataFile, DataSourceMetadata.class);
            ConsoleOutput.info("Understanding request...");
            state = engine.generate(engine.generateRequestId(), userId, prompt, metadata,
                    failFast ? Boolean.TRUE : null, skipGrounding);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Generation failed: " + e.getMessage());
            return 1;
        }

        if (state.hasErrors()) {
            ConsoleOutput.pipelineErrors(state.errors());
            if (outFile != null) {
                JsonFiles.write(outFile, WorkflowResponses.failed(state));
            }
            return 1;
        }

        GenerateResponse response = WorkflowResponses.generated(state, llmService.providerName());
        var grounded = response.groundedPlan();
        ConsoleOutput.success("Goal: " + grounded.goal());
        ConsoleOutput.info(String.format("Grounding: %d/%d validated, %d skipped, confidence %.2f",
                grounded.validatedAssumptionsCount(), grounded.totalAssumptionsCount(),
                grounded.skippedAssumptionsCount(), grounded.groundingConfidence()));
        if (response.ambiguityReport() != null) {
            ConsoleOutput.ambiguityReport(response.ambiguityReport());
        }
        ConsoleOutput.phaseTimes(response.metadata().phaseTimesMs());
        if (outFile != null) {
            JsonFiles.write(outFile, response);
            ConsoleOutput.info("Response written to " + outFile);
        }
        return 0;
    }
}
