package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A validated evaluation returned by the model for one persona.
 * <p>
 * {@code modelReportedAverage} is kept for audit and display only; scoring always
 * recomputes the average from {@code criterionScores}.
 */
public record PersonaEvaluation(
    Persona persona,
    List<CriterionScore> criterionScores,
    Double modelReportedAverage,
    String modelRecommendation
) implements Serializable {

    public PersonaEvaluation {
        if (criterionScores == null || criterionScores.isEmpty()) {
            throw new IllegalArgumentException("Evaluation for " + (persona != null ? persona.key() : "?")
                    + " has no criterion scores");
        }
        criterionScores = List.copyOf(criterionScores);
    }
}
