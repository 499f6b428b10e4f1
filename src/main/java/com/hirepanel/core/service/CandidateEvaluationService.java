package com.hirepanel.core.service;

import com.hirepanel.core.classifier.DomainAssignments;
import com.hirepanel.core.classifier.DomainClassifier;
import com.hirepanel.core.engine.EvaluationInProgressException;
import com.hirepanel.core.engine.EvaluationOrchestrator;
import com.hirepanel.core.engine.EvaluationProperties;
import com.hirepanel.core.engine.EvaluationRun;
import com.hirepanel.core.engine.RunOptions;
import com.hirepanel.core.insight.InsightExtractor;
import com.hirepanel.core.llm.LlmProperties;
import com.hirepanel.core.logging.MdcContext;
import com.hirepanel.core.metrics.EvaluationMetrics;
import com.hirepanel.core.model.CompositeResult;
import com.hirepanel.core.model.EvaluationOutcome;
import com.hirepanel.core.model.EvaluationReport;
import com.hirepanel.core.model.EvaluationRequest;
import com.hirepanel.core.model.MissingPersona;
import com.hirepanel.core.model.Persona;
import com.hirepanel.core.model.PersonaEvaluation;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.model.QualitativeInsights;
import com.hirepanel.core.model.RunStatus;
import com.hirepanel.core.persona.PersonaLoader;
import com.hirepanel.core.persona.PersonaRegistry;
import com.hirepanel.core.report.ReportGenerator;
import com.hirepanel.core.scoring.ScoreAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs the full pipeline for one candidate: load personas, classify priority
 * keywords, fan out persona evaluations, then score, mine insights and render
 * the report.
 * <p>
 * Persona configuration errors surface before any model call. A run where every
 * persona failed raises {@link EvaluationFailedException}; a partially failed run
 * still yields a report that lists the missing personas. {@link #evaluateBatch} runs the
 * same pipeline for several candidates.
 */
@Service
public class CandidateEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(CandidateEvaluationService.class);

    private final PersonaLoader personaLoader;
    private final DomainClassifier domainClassifier;
    private final EvaluationOrchestrator orchestrator;
    private final ScoreAggregator scoreAggregator;
    private final InsightExtractor insightExtractor;
    private final ReportGenerator reportGenerator;
    private final LlmProperties llmProperties;
    private final EvaluationProperties evaluationProperties;
    private final EvaluationMetrics metrics;

    public CandidateEvaluationService(PersonaLoader personaLoader,
                                      DomainClassifier domainClassifier,
                                      EvaluationOrchestrator orchestrator,
                                      ScoreAggregator scoreAggregator,
                                      InsightExtractor insightExtractor,
                                      ReportGenerator reportGenerator,
                                      LlmProperties llmProperties,
                                      EvaluationProperties evaluationProperties,
                                      EvaluationMetrics metrics) {
        this.personaLoader = personaLoader;
        this.domainClassifier = domainClassifier;
        this.orchestrator = orchestrator;
        this.scoreAggregator = scoreAggregator;
        this.insightExtractor = insightExtractor;
        this.reportGenerator = reportGenerator;
        this.llmProperties = llmProperties;
        this.evaluationProperties = evaluationProperties;
        this.metrics = metrics;
    }

    public EvaluationReport evaluate(CandidateSubmission submission, EvaluationSettings settings) {
        return evaluate(newRunId(), submission, settings);
    }

    /**
     * @param runId caller-chosen run identifier, so the caller can subscribe to events first
     */
    public EvaluationReport evaluate(String runId, CandidateSubmission submission, EvaluationSettings settings) {
        MdcContext.setRun(runId, submission.candidateName());
        try {
            PersonaRegistry registry = personaLoader.load();

            String modelName = llmProperties.resolveModel(settings.modelOverride(), settings.fastMode());
            double temperature = llmProperties.temperatureFor(modelName);
            log.info("Evaluating {} with {} persona(s), model {} (temperature {})",
                    submission.candidateName(), registry.size(), modelName, temperature);

            DomainAssignments assignments = domainClassifier.assign(submission.priorityKeywords(), registry);
            List<EvaluationRequest> requests = registry.personas().stream()
                    .map(persona -> new EvaluationRequest(
                            persona,
                            submission.resume(),
                            submission.jobPosting(),
                            domainClassifier.contextPrompt(assignments.keywordsFor(persona.key())),
                            modelName,
                            temperature))
                    .toList();

            EvaluationRun run = orchestrator.run(runId, candidateKey(submission.candidateName()),
                    requests, runOptions(settings));
            if (run.status() == RunStatus.FAILURE) {
                throw new EvaluationFailedException(run.outcomes());
            }

            List<PersonaEvaluation> evaluations = run.successes().stream()
                    .map(EvaluationOutcome.Success::evaluation)
                    .toList();
            List<ProcessedPersonaResult> processed = scoreAggregator.process(evaluations);
            QualitativeInsights insights = insightExtractor.extract(processed);
            List<MissingPersona> missing = run.failures().stream()
                    .map(f -> new MissingPersona(f.personaKey(), displayName(registry, f.personaKey()),
                            f.errorKind(), f.detail()))
                    .toList();
            CompositeResult composite = scoreAggregator.composite(processed, insights, missing);
            metrics.recordCompositeScore(composite.weightedScore());

            String markdown = reportGenerator.render(submission.candidateName(), composite, processed);
            log.info("Evaluation of {} complete: {} ({}), status {}", submission.candidateName(),
                    composite.weightedScore(), composite.assessmentTier().label(), run.status());
            return new EvaluationReport(runId, submission.candidateName(), modelName, run.status(),
                    run.outcomes(), processed, composite, markdown);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Evaluates candidates one after another with the fast model unless a model is given.
     * A candidate that fails, or appears a second time in the batch, is recorded as a failed
     * entry and the batch continues. Persona configuration errors abort the whole batch
     * before any call.
     *
     * @throws IllegalArgumentException if {@code submissions} is empty
     */
    public BatchResult evaluateBatch(List<CandidateSubmission> submissions, EvaluationSettings settings) {
        if (submissions == null || submissions.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate is required");
        }
        personaLoader.load();
        var batchSettings = new EvaluationSettings(settings.modelOverride(), true,
                settings.concurrency(), settings.timeoutSeconds(), settings.cancellationToken());
        log.info("Batch evaluation of {} candidate(s)", submissions.size());

        var seen = new HashSet<String>();
        var entries = new ArrayList<BatchResult.Entry>();
        for (CandidateSubmission submission : submissions) {
            String name = submission.candidateName();
            if (!seen.add(candidateKey(name))) {
                log.warn("Candidate {} appears more than once in the batch, skipping", name);
                entries.add(BatchResult.Entry.failed(name,
                        "Candidate '" + candidateKey(name) + "' appears more than once in the batch"));
                continue;
            }
            try {
                entries.add(BatchResult.Entry.succeeded(name, evaluate(submission, batchSettings)));
            } catch (EvaluationFailedException | EvaluationInProgressException e) {
                log.warn("Batch evaluation of {} failed: {}", name, e.getMessage());
                entries.add(BatchResult.Entry.failed(name, e.getMessage()));
            }
        }

        BatchResult result = BatchResult.of(entries);
        log.info("Batch complete: {} of {} candidate(s) evaluated, {} failed",
                result.successful(), result.total(), result.failed());
        return result;
    }

    private RunOptions runOptions(EvaluationSettings settings) {
        int concurrency = settings.concurrency() != null
                ? settings.concurrency() : evaluationProperties.getConcurrency();
        int timeoutSeconds = settings.timeoutSeconds() != null
                ? settings.timeoutSeconds() : evaluationProperties.getTimeoutSeconds();
        return new RunOptions(concurrency, Duration.ofSeconds(timeoutSeconds), settings.cancellationToken());
    }

    private static String displayName(PersonaRegistry registry, String key) {
        return registry.find(key).map(Persona::displayName).orElse(key);
    }

    static String candidateKey(String candidateName) {
        return candidateName.trim().toLowerCase(Locale.ROOT);
    }

    public static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
