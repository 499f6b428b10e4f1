package com.hirepanel.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.classifier.PriorityKeywordLoader;
import com.hirepanel.core.engine.CancellationToken;
import com.hirepanel.core.engine.EvaluationInProgressException;
import com.hirepanel.core.events.EventBus;
import com.hirepanel.core.model.EvaluationOutcome;
import com.hirepanel.core.model.EvaluationReport;
import com.hirepanel.core.model.PriorityKeyword;
import com.hirepanel.core.persona.PersonaConfigurationException;
import com.hirepanel.core.service.CandidateEvaluationService;
import com.hirepanel.core.service.CandidateSubmission;
import com.hirepanel.core.service.EvaluationFailedException;
import com.hirepanel.core.service.EvaluationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: hirepanel evaluate --resume &lt;json&gt; --job-posting &lt;md&gt;
 * <p>
 * Runs every enabled persona against the candidate, prints progress and the score
 * summary, and writes the JSON results and Markdown report to the output directory.
 * Ctrl-C cancels in-flight persona calls.
 */
@Command(name = "evaluate", mixinStandardHelpOptions = true, description = "Evaluate a candidate against a job posting")
@Component
public class EvaluateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EvaluateCommand.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Option(names = {"--resume", "-r"}, required = true, description = "Resume as structured JSON")
    private Path resume;

    @Option(names = {"--job-posting", "-j"}, required = true, description = "Job posting text or markdown")
    private Path jobPosting;

    @Option(names = {"--keywords", "-k"}, description = "Keyword analysis JSON (knockout_requirements, skills_ranked)")
    private Path keywords;

    @Option(names = "--candidate", description = "Candidate name; defaults to the name in the resume")
    private String candidate;

    @Option(names = {"--model", "-m"}, description = "Model to use; overrides --fast")
    private String model;

    @Option(names = "--fast", description = "Use the fast model")
    private boolean fast;

    @Option(names = "--concurrency", description = "Maximum persona calls in flight")
    private Integer concurrency;

    @Option(names = "--timeout", description = "Per-persona timeout in seconds")
    private Integer timeoutSeconds;

    @Option(names = {"--output", "-o"}, description = "Output directory", defaultValue = ".")
    private Path output;

    private final CandidateEvaluationService evaluationService;
    private final PriorityKeywordLoader keywordLoader;
    private final EvaluationResultWriter resultWriter;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public EvaluateCommand(CandidateEvaluationService evaluationService, PriorityKeywordLoader keywordLoader,
                           EvaluationResultWriter resultWriter, EventBus eventBus, ObjectMapper objectMapper) {
        this.evaluationService = evaluationService;
        this.keywordLoader = keywordLoader;
        this.resultWriter = resultWriter;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String invalid = invalidRunOptions(concurrency, timeoutSeconds);
        if (invalid != null) {
            ConsoleOutput.error(invalid);
            return EXIT_USAGE;
        }

        JsonNode resumeJson;
        String posting;
        List<PriorityKeyword> priorities;
        try {
            resumeJson = readResume(objectMapper, resume);
            posting = Files.readString(jobPosting);
            priorities = keywords != null ? keywordLoader.load(keywords) : List.of();
        } catch (IOException | RuntimeException e) {
            ConsoleOutput.error("Cannot read inputs: " + rootCauseMessage(e));
            return EXIT_USAGE;
        }

        String name = candidate != null && !candidate.isBlank() ? candidate : candidateName(resumeJson);
        ConsoleOutput.info("Candidate: " + name);

        var token = new CancellationToken();
        Thread shutdownHook = new Thread(token::cancel, "hirepanel-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        String runId = CandidateEvaluationService.newRunId();
        var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
        try {
            EvaluationReport report = evaluationService.evaluate(runId,
                    new CandidateSubmission(name, resumeJson, posting, priorities),
                    new EvaluationSettings(model, fast, concurrency, timeoutSeconds, token));
            ConsoleOutput.summary(report);

            var files = resultWriter.write(report, output);
            ConsoleOutput.success("Results: " + files.results());
            ConsoleOutput.success("Report: " + files.report());
            return 0;
        } catch (EvaluationFailedException e) {
            ConsoleOutput.error("No persona produced an evaluation:");
            for (EvaluationOutcome outcome : e.outcomes()) {
                if (outcome instanceof EvaluationOutcome.Failure failure) {
                    ConsoleOutput.error("  " + failure.personaKey() + ": " + failure.errorKind() + " " + failure.detail());
                }
            }
            return EXIT_FAILED;
        } catch (PersonaConfigurationException | EvaluationInProgressException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write results: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Reads a resume and checks that it carries a {@code basics} or {@code personalInfo} section.
     */
    static JsonNode readResume(ObjectMapper objectMapper, Path path) throws IOException {
        JsonNode json = objectMapper.readTree(Files.readString(path));
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException(path + " is not a JSON object");
        }
        if (!json.has("basics") && !json.has("personalInfo")) {
            throw new IllegalArgumentException(path + ": resume must include a personalInfo or basics section");
        }
        return json;
    }

    /** Returns a message describing the first invalid option, or null. */
    static String invalidRunOptions(Integer concurrency, Integer timeoutSeconds) {
        if (concurrency != null && concurrency < 1) {
            return "--concurrency must be at least 1, got " + concurrency;
        }
        if (timeoutSeconds != null && timeoutSeconds < 1) {
            return "--timeout must be at least 1 second, got " + timeoutSeconds;
        }
        return null;
    }

    static String candidateName(JsonNode resume) {
        for (String path : List.of("/basics/name", "/personalInfo/name")) {
            String name = resume.at(path).asText("");
            if (!name.isBlank()) {
                return name;
            }
        }
        return "Candidate";
    }

    static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, cancel hook has run");
        }
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
