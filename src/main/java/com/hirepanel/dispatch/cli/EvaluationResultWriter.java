package com.hirepanel.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.EvaluationOutcome;
import com.hirepanel.core.model.EvaluationReport;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.service.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Persists a finished evaluation: {@value #RESULTS_FILE} with the structured
 * results and {@code <candidate-slug>-evaluation.md} with the rendered report.
 * A batch writes each candidate into its own {@code <candidate-slug>} directory plus
 * {@value #BATCH_SUMMARY_FILE}.
 */
@Component
public class EvaluationResultWriter {

    private static final Logger log = LoggerFactory.getLogger(EvaluationResultWriter.class);

    static final String RESULTS_FILE = "evaluation-results.json";
    static final String BATCH_SUMMARY_FILE = "batch-summary.json";

    private final ObjectMapper objectMapper;

    public EvaluationResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record WrittenFiles(Path results, Path report) {}

    public WrittenFiles write(EvaluationReport report, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path results = outputDir.resolve(RESULTS_FILE);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(results.toFile(), toDocument(report));

        Path markdown = outputDir.resolve(slug(report.candidateName()) + "-evaluation.md");
        Files.writeString(markdown, report.markdown());
        log.info("Wrote {} and {}", results, markdown);
        return new WrittenFiles(results, markdown);
    }

    /**
     * @return the batch summary file
     */
    public Path writeBatch(BatchResult batch, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        var evaluations = new ArrayList<Map<String, Object>>();
        for (BatchResult.Entry entry : batch.evaluations()) {
            var doc = new LinkedHashMap<String, Object>();
            doc.put("candidate", entry.candidateName());
            doc.put("success", entry.success());
            if (entry.success()) {
                EvaluationReport report = entry.report();
                WrittenFiles files = write(report, outputDir.resolve(slug(report.candidateName())));
                doc.put("runId", report.runId());
                doc.put("runStatus", report.runStatus().name());
                doc.put("weightedScore", report.composite().weightedScore());
                doc.put("assessmentTier", report.composite().assessmentTier().label());
                doc.put("results", outputDir.relativize(files.results()).toString());
            } else {
                doc.put("error", entry.error());
            }
            evaluations.add(doc);
        }

        var counts = new LinkedHashMap<String, Object>();
        counts.put("total", batch.total());
        counts.put("successful", batch.successful());
        counts.put("failed", batch.failed());
        var summary = new LinkedHashMap<String, Object>();
        summary.put("timestamp", Instant.now());
        summary.put("batchSummary", counts);
        summary.put("evaluations", evaluations);

        Path summaryFile = outputDir.resolve(BATCH_SUMMARY_FILE);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryFile.toFile(), summary);
        log.info("Wrote batch summary {}", summaryFile);
        return summaryFile;
    }

    Map<String, Object> toDocument(EvaluationReport report) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("timestamp", Instant.now());
        doc.put("runId", report.runId());
        doc.put("model", report.modelName());
        doc.put("candidate", report.candidateName());
        doc.put("runStatus", report.runStatus().name());
        doc.put("outcomes", report.outcomes().stream().map(EvaluationResultWriter::outcome).toList());
        doc.put("processedResults", report.processedResults().stream().map(EvaluationResultWriter::processed).toList());

        var composite = report.composite();
        var compositeDoc = new LinkedHashMap<String, Object>();
        compositeDoc.put("weightedScore", composite.weightedScore());
        compositeDoc.put("assessmentTier", composite.assessmentTier().label());
        compositeDoc.put("recommendation", composite.assessmentTier().recommendation());
        compositeDoc.put("strongestPersona", composite.strongestPersona());
        compositeDoc.put("weakestPersona", composite.weakestPersona());
        compositeDoc.put("varianceAcrossPersonas", composite.varianceAcrossPersonas());
        compositeDoc.put("consensusLevel", composite.consensusLevel().label());
        compositeDoc.put("insights", composite.insights());
        compositeDoc.put("missingPersonas", composite.missingPersonas());
        doc.put("composite", compositeDoc);
        return doc;
    }

    private static Map<String, Object> outcome(EvaluationOutcome outcome) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("persona", outcome.personaKey());
        if (outcome instanceof EvaluationOutcome.Failure failure) {
            doc.put("status", "failed");
            doc.put("errorKind", failure.errorKind().name());
            doc.put("detail", failure.detail());
        } else {
            doc.put("status", "success");
        }
        return doc;
    }

    private static Map<String, Object> processed(ProcessedPersonaResult result) {
        var scores = new LinkedHashMap<String, Object>();
        for (CriterionScore score : result.criterionScores()) {
            scores.put(score.name(), Map.of("score", score.score(), "reasoning", score.reasoning()));
        }
        var doc = new LinkedHashMap<String, Object>();
        doc.put("persona", result.persona().key());
        doc.put("displayName", result.persona().displayName());
        doc.put("scores", scores);
        doc.put("recomputedAverage", result.recomputedAverage());
        doc.put("modelReportedAverage", result.modelReportedAverage());
        doc.put("weight", result.weight());
        doc.put("weightedContribution", result.weightedContribution());
        doc.put("recommendation", result.recommendation());
        return doc;
    }

    static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "candidate" : slug;
    }
}
