package com.hirepanel.dispatch.cli;

import com.hirepanel.core.events.EvaluationEvent;
import com.hirepanel.core.model.CompositeResult;
import com.hirepanel.core.model.EvaluationReport;
import com.hirepanel.core.model.ProcessedPersonaResult;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the HirePanel CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIREPANEL v0.1.0|@"));
        System.out.println("----------------------------------");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIREPANEL]|@ " + message));
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

    /**
     * Prints run and persona lifecycle events. Intermediate state transitions are skipped.
     */
    public static void event(EvaluationEvent event) {
        var payload = event.payload();
        switch (event.eventType()) {
            case EvaluationEvent.RUN_STARTED -> info("Evaluating with " + payload.get("personas")
                    + " personas (concurrency " + payload.get("concurrency") + ")");
            case EvaluationEvent.PERSONA_COMPLETED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) DONE|@ " + payload.get("persona")
                    + " (" + formatDuration(((Number) payload.get("elapsedMs")).longValue()) + ")"));
            case EvaluationEvent.PERSONA_FAILED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) FAIL|@ " + payload.get("persona") + " [" + payload.get("errorKind") + "] "
                    + payload.get("detail")));
            case EvaluationEvent.RUN_COMPLETED -> info("Run " + payload.get("status").toString().toLowerCase(Locale.ROOT)
                    + ": " + payload.get("failed") + " of " + payload.get("total") + " failed");
            default -> {
                // persona.state transitions are logged, not printed
            }
        }
    }

    public static void summary(EvaluationReport report) {
        CompositeResult composite = report.composite();
        System.out.println("----------------------------------");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Evaluation: " + report.candidateName() + "|@"));
        for (ProcessedPersonaResult result : report.processedResults()) {
            System.out.printf(Locale.ROOT, "  %-26s %5.2f  x %3d%%  = %5.2f%n",
                    result.persona().displayName(), result.recomputedAverage(),
                    Math.round(result.weight() * 100), result.weightedContribution());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  @|bold Final score: %.2f/10|@ (%s) - %s",
                composite.weightedScore(), composite.assessmentTier().label(),
                composite.assessmentTier().recommendation())));
        System.out.println(String.format(Locale.ROOT, "  Consensus: %s (%.2f point variance)",
                composite.consensusLevel().label(), composite.varianceAcrossPersonas()));
        composite.missingPersonas().forEach(m ->
                warn("Missing " + m.displayName() + ": " + m.errorKind()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
