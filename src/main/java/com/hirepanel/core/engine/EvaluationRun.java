package com.hirepanel.core.engine;

import com.hirepanel.core.model.EvaluationOutcome;
import com.hirepanel.core.model.RunStatus;

import java.util.List;

/**
 * Resolved outcomes of one run, in persona enumeration order.
 */
public record EvaluationRun(
    String runId,
    List<EvaluationOutcome> outcomes,
    RunStatus status
) {

    public EvaluationRun {
        outcomes = List.copyOf(outcomes);
    }

    public List<EvaluationOutcome.Success> successes() {
        return outcomes.stream()
                .filter(EvaluationOutcome.Success.class::isInstance)
                .map(EvaluationOutcome.Success.class::cast)
                .toList();
    }

    public List<EvaluationOutcome.Failure> failures() {
        return outcomes.stream()
                .filter(EvaluationOutcome.Failure.class::isInstance)
                .map(EvaluationOutcome.Failure.class::cast)
                .toList();
    }
}
