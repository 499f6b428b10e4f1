package com.hirepanel.core.scoring;

import com.hirepanel.core.model.AssessmentTier;
import com.hirepanel.core.model.CompositeResult;
import com.hirepanel.core.model.ConsensusLevel;
import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.MissingPersona;
import com.hirepanel.core.model.PersonaEvaluation;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.model.QualitativeInsights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deterministic scoring over successful persona evaluations.
 * <p>
 * Averages are always recomputed from the criterion scores; the model's own average
 * is carried through for display only. The composite is the weighted sum of those
 * averages. Personas that failed contribute nothing and, unless
 * {@link ScoringProperties#isRenormalizeMissingWeights()} is set, the remaining
 * weights are used as configured.
 */
@Component
public class ScoreAggregator {

    private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

    private final ScoringProperties properties;

    public ScoreAggregator(ScoringProperties properties) {
        this.properties = properties;
    }

    public List<ProcessedPersonaResult> process(List<PersonaEvaluation> evaluations) {
        return evaluations.stream().map(ScoreAggregator::processOne).toList();
    }

    static ProcessedPersonaResult processOne(PersonaEvaluation evaluation) {
        double average = round2(evaluation.criterionScores().stream()
                .mapToInt(CriterionScore::score)
                .average()
                .orElseThrow());
        if (evaluation.modelReportedAverage() != null
                && Math.abs(evaluation.modelReportedAverage() - average) > 0.01) {
            log.debug("{}: model reported {} but criteria average {}", evaluation.persona().key(),
                    evaluation.modelReportedAverage(), average);
        }
        return new ProcessedPersonaResult(
                evaluation.persona(),
                evaluation.criterionScores(),
                average,
                evaluation.modelReportedAverage(),
                evaluation.persona().weight(),
                evaluation.modelRecommendation());
    }

    /**
     * Builds the composite for a run.
     *
     * @param processed results in run order; must not be empty
     * @param insights  qualitative insights for the same results
     * @param missing   personas that failed, listed in the report
     */
    public CompositeResult composite(List<ProcessedPersonaResult> processed, QualitativeInsights insights,
                                     List<MissingPersona> missing) {
        if (processed.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate a run without successful personas");
        }

        double weighted = processed.stream()
                .mapToDouble(r -> r.recomputedAverage() * r.weight())
                .sum();
        if (properties.isRenormalizeMissingWeights() && !missing.isEmpty()) {
            double presentWeight = processed.stream().mapToDouble(ProcessedPersonaResult::weight).sum();
            if (presentWeight > 0) {
                weighted = weighted / presentWeight;
            }
        }
        double weightedScore = round2(weighted);
        AssessmentTier tier = AssessmentTier.forScore(weightedScore);

        ProcessedPersonaResult strongest = processed.get(0);
        ProcessedPersonaResult weakest = processed.get(0);
        for (ProcessedPersonaResult result : processed) {
            if (result.recomputedAverage() > strongest.recomputedAverage()) {
                strongest = result;
            }
            if (result.recomputedAverage() < weakest.recomputedAverage()) {
                weakest = result;
            }
        }
        double variance = round2(strongest.recomputedAverage() - weakest.recomputedAverage());

        log.info("Composite {} ({}), variance {} across {} persona(s)", weightedScore, tier.label(),
                variance, processed.size());
        return new CompositeResult(
                weightedScore,
                tier,
                strongest.persona().displayName(),
                strongest.recomputedAverage(),
                weakest.persona().displayName(),
                weakest.recomputedAverage(),
                variance,
                ConsensusLevel.forVariance(variance),
                insights,
                missing);
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
