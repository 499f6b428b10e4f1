package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregated result of a completed run, built once from all successful personas.
 *
 * @param weightedScore          sum of recomputed average times weight, two decimals
 * @param assessmentTier         tier for {@code weightedScore}
 * @param strongestPersona       display name of the highest-scoring persona
 * @param weakestPersona         display name of the lowest-scoring persona
 * @param varianceAcrossPersonas max minus min of the recomputed averages
 * @param consensusLevel         level derived from the variance
 * @param insights               qualitative insights mined from the reasoning
 * @param missingPersonas        personas that failed and are absent from the score
 */
public record CompositeResult(
    double weightedScore,
    AssessmentTier assessmentTier,
    String strongestPersona,
    double strongestScore,
    String weakestPersona,
    double weakestScore,
    double varianceAcrossPersonas,
    ConsensusLevel consensusLevel,
    QualitativeInsights insights,
    List<MissingPersona> missingPersonas
) implements Serializable {

    public CompositeResult {
        missingPersonas = missingPersonas != null ? List.copyOf(missingPersonas) : List.of();
    }
}
