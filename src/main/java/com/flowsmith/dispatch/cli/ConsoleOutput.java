package com.flowsmith.dispatch.cli;

import com.flowsmith.core.model.AmbiguityReport;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.AiProcessingStep;
import com.flowsmith.core.workflow.ConditionalStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import com.flowsmith.core.workflow.WorkflowSteps;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Flowsmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLOWSMITH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLOWSMITH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void pipelineErrors(List<PipelineError> errors) {
        for (PipelineError e : errors) {
            error("[" + e.phase().value() + "] " + e.code() + ": " + e.message());
        }
    }

    public static void ambiguityReport(AmbiguityReport report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Review|@ (confidence " + String.format("%.2f", report.overallConfidence()) + ")"));
        section("fg(red)", "MUST CONFIRM", report.mustConfirm());
        section("fg(yellow)", "SHOULD REVIEW", report.shouldReview());
        section("fg(green)", "LOOKS GOOD", report.looksGood());
        section("fg(magenta)", "FIELD CHOICES", report.groundingAmbiguities());
    }

    private static void section(String style, String title, List<AmbiguityReport.ReviewItem> items) {
        if (items.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + style + " " + title + " (" + items.size() + ")|@"));
        for (AmbiguityReport.ReviewItem item : items) {
            String text = item.question() != null ? item.question() : item.reason();
            System.out.println("    - " + item.id() + ": " + text);
        }
    }

    public static void steps(List<WorkflowStep> steps) {
        printSteps(steps, "  ");
    }

    private static void printSteps(List<WorkflowStep> steps, String indent) {
        for (WorkflowStep step : steps) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    indent + "@|fg(cyan) " + step.id() + "|@ " + label(step)));
            List<WorkflowStep> children = WorkflowSteps.children(step);
            if (!children.isEmpty()) {
                printSteps(children, indent + "    ");
            }
        }
    }

    private static String label(WorkflowStep step) {
        if (step instanceof ActionStep action) {
            return "[action] " + action.plugin() + "." + action.action();
        }
        if (step instanceof TransformStep transform) {
            return "[transform] " + transform.operation();
        }
        if (step instanceof AiProcessingStep) {
            return "[ai_processing] " + step.description();
        }
        if (step instanceof ScatterGatherStep scatterGather) {
            String input = scatterGather.scatter() == null ? "?" : scatterGather.scatter().input();
            return "[scatter_gather] over " + input;
        }
        if (step instanceof ConditionalStep conditional) {
            return "[conditional] " + conditional.condition();
        }
        return step.description();
    }

    public static void phaseTimes(Map<String, Long> times) {
        StringBuilder sb = new StringBuilder("  Phases:");
        times.forEach((phase, ms) -> sb.append(' ').append(phase).append('=').append(formatDuration(ms)));
        System.out.println(sb);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
