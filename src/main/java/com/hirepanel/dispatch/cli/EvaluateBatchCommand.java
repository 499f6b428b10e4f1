package com.hirepanel.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.classifier.PriorityKeywordLoader;
import com.hirepanel.core.engine.CancellationToken;
import com.hirepanel.core.events.EventBus;
import com.hirepanel.core.model.PriorityKeyword;
import com.hirepanel.core.persona.PersonaConfigurationException;
import com.hirepanel.core.service.BatchResult;
import com.hirepanel.core.service.CandidateEvaluationService;
import com.hirepanel.core.service.CandidateSubmission;
import com.hirepanel.core.service.EvaluationSettings;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: hirepanel evaluate-batch --resume a.json --resume b.json --job-posting &lt;md&gt;
 * <p>
 * Evaluates every resume against one job posting, using the fast model unless
 * {@code --model} is given. Each candidate gets its own output directory; the batch
 * summary lands in the output directory itself.
 */
@Command(name = "evaluate-batch", mixinStandardHelpOptions = true,
        description = "Evaluate several candidates against one job posting")
@Component
public class EvaluateBatchCommand implements Callable<Integer> {

    @Option(names = {"--resume", "-r"}, required = true, arity = "1..*",
            description = "Resume as structured JSON; repeat for each candidate")
    private List<Path> resumes;

    @Option(names = {"--job-posting", "-j"}, required = true, description = "Job posting text or markdown")
    private Path jobPosting;

    @Option(names = {"--keywords", "-k"}, description = "Keyword analysis JSON (knockout_requirements, skills_ranked)")
    private Path keywords;

    @Option(names = {"--model", "-m"}, description = "Model to use instead of the fast model")
    private String model;

    @Option(names = "--concurrency", description = "Maximum persona calls in flight per candidate")
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

    public EvaluateBatchCommand(CandidateEvaluationService evaluationService, PriorityKeywordLoader keywordLoader,
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

        String invalid = EvaluateCommand.invalidRunOptions(concurrency, timeoutSeconds);
        if (invalid != null) {
            ConsoleOutput.error(invalid);
            return EvaluateCommand.EXIT_USAGE;
        }

        var submissions = new ArrayList<CandidateSubmission>();
        try {
            String posting = Files.readString(jobPosting);
            List<PriorityKeyword> priorities = keywords != null ? keywordLoader.load(keywords) : List.of();
            for (Path resume : resumes) {
                JsonNode resumeJson = EvaluateCommand.readResume(objectMapper, resume);
                submissions.add(new CandidateSubmission(EvaluateCommand.candidateName(resumeJson),
                        resumeJson, posting, priorities));
            }
        } catch (IOException | RuntimeException e) {
            ConsoleOutput.error("Cannot read inputs: " + EvaluateCommand.rootCauseMessage(e));
            return EvaluateCommand.EXIT_USAGE;
        }
        ConsoleOutput.info("Candidates: " + submissions.size());

        var token = new CancellationToken();
        Thread shutdownHook = new Thread(token::cancel, "hirepanel-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        try {
            BatchResult batch = evaluationService.evaluateBatch(submissions,
                    new EvaluationSettings(model, true, concurrency, timeoutSeconds, token));

            for (BatchResult.Entry entry : batch.evaluations()) {
                if (entry.success()) {
                    var composite = entry.report().composite();
                    ConsoleOutput.success(String.format(Locale.ROOT, "%s: %.2f/10 (%s)", entry.candidateName(),
                            composite.weightedScore(), composite.assessmentTier().label()));
                } else {
                    ConsoleOutput.error(entry.candidateName() + ": " + entry.error());
                }
            }
            ConsoleOutput.info(batch.successful() + " of " + batch.total() + " candidate(s) evaluated, "
                    + batch.failed() + " failed");

            Path summary = resultWriter.writeBatch(batch, output);
            ConsoleOutput.success("Batch summary: " + summary);
            return batch.successful() > 0 ? 0 : EvaluateCommand.EXIT_FAILED;
        } catch (PersonaConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return EvaluateCommand.EXIT_FAILED;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write results: " + EvaluateCommand.rootCauseMessage(e));
            return EvaluateCommand.EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
            EvaluateCommand.removeShutdownHook(shutdownHook);
        }
    }
}
