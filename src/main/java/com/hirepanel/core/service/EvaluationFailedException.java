package com.hirepanel.core.service;

import com.hirepanel.core.model.EvaluationOutcome;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no persona produced a usable evaluation. No report exists for such a run;
 * the outcomes explain why each persona failed.
 */
public class EvaluationFailedException extends RuntimeException {

    private final List<EvaluationOutcome> outcomes;

    public EvaluationFailedException(List<EvaluationOutcome> outcomes) {
        super("All persona evaluations failed: " + summarize(outcomes));
        this.outcomes = List.copyOf(outcomes);
    }

    public List<EvaluationOutcome> outcomes() {
        return outcomes;
    }

    private static String summarize(List<EvaluationOutcome> outcomes) {
        return outcomes.stream()
                .filter(EvaluationOutcome.Failure.class::isInstance)
                .map(EvaluationOutcome.Failure.class::cast)
                .map(f -> f.personaKey() + "=" + f.errorKind())
                .collect(Collectors.joining(", "));
    }
}
