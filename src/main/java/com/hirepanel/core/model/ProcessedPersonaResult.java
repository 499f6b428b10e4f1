package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Scoring view of a successful persona evaluation. Derived, never model-authored:
 * {@code recomputedAverage} is the mean of the criterion scores rounded to two decimals.
 */
public record ProcessedPersonaResult(
    Persona persona,
    List<CriterionScore> criterionScores,
    double recomputedAverage,
    Double modelReportedAverage,
    double weight,
    String recommendation
) implements Serializable {

    public ProcessedPersonaResult {
        criterionScores = List.copyOf(criterionScores);
    }

    public double weightedContribution() {
        return Math.round(recomputedAverage * weight * 100) / 100.0;
    }
}
