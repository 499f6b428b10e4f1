package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured result of one candidate evaluation, handed to the caller for persistence.
 */
public record EvaluationReport(
    String runId,
    String candidateName,
    String modelName,
    RunStatus runStatus,
    List<EvaluationOutcome> outcomes,
    List<ProcessedPersonaResult> processedResults,
    CompositeResult composite,
    String markdown
) implements Serializable {

    public EvaluationReport {
        outcomes = List.copyOf(outcomes);
        processedResults = List.copyOf(processedResults);
    }
}
