package com.hirepanel.core.scoring;

import com.hirepanel.core.model.AssessmentTier;
import com.hirepanel.core.model.CompositeResult;
import com.hirepanel.core.model.ConsensusLevel;
import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.ErrorKind;
import com.hirepanel.core.model.MissingPersona;
import com.hirepanel.core.model.Persona;
import com.hirepanel.core.model.PersonaEvaluation;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.model.QualitativeInsights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.hirepanel.core.TestData.evaluation;
import static com.hirepanel.core.TestData.persona;
import static org.junit.jupiter.api.Assertions.*;

class ScoreAggregatorTest {

    private final ScoringProperties properties = new ScoringProperties();
    private final ScoreAggregator aggregator = new ScoreAggregator(properties);

    private static final Persona HR = persona("hr", 0.20, "experience_match", "cultural_fit");
    private static final Persona TECH = persona("technical", 0.15, "technical_depth", "problem_solving");
    private static final Persona DESIGN = persona("design", 0.15, "product_craft", "design_collaboration");
    private static final Persona FINANCE = persona("finance", 0.20, "financial_acumen", "growth_strategy");
    private static final Persona CEO = persona("ceo", 0.20, "organizational_impact", "leadership_culture_fit");
    private static final Persona TEAM = persona("team", 0.10, "management_mentorship", "practical_leadership");

    private CompositeResult composite(List<PersonaEvaluation> evaluations, List<MissingPersona> missing) {
        return aggregator.composite(aggregator.process(evaluations), QualitativeInsights.empty(), missing);
    }

    @Nested
    @DisplayName("per-persona processing")
    class Processing {

        @Test
        @DisplayName("recomputes the average from criterion scores, rounded to two decimals")
        void recomputesAverage() {
            ProcessedPersonaResult result = ScoreAggregator.processOne(
                    evaluation(persona("p", 0.5, "a", "b", "c"), 7, 8, 8));

            assertEquals(7.67, result.recomputedAverage());
            assertEquals(0.5, result.weight());
        }

        @Test
        @DisplayName("ignores the model's own average")
        void ignoresModelAverage() {
            var evaluation = new PersonaEvaluation(HR,
                    List.of(new CriterionScore("experience_match", 6, ""), new CriterionScore("cultural_fit", 6, "")),
                    9.5, "Hire");

            ProcessedPersonaResult result = ScoreAggregator.processOne(evaluation);

            assertEquals(6.0, result.recomputedAverage());
            assertEquals(9.5, result.modelReportedAverage());
            assertEquals("Hire", result.recommendation());
        }

        @Test
        @DisplayName("keeps run order")
        void keepsOrder() {
            var processed = aggregator.process(List.of(evaluation(TECH, 5, 5), evaluation(HR, 9, 9)));

            assertEquals(List.of("technical", "hr"), processed.stream().map(r -> r.persona().key()).toList());
        }
    }

    @Nested
    @DisplayName("composite")
    class Composite {

        @Test
        @DisplayName("uniform sevens across the full panel give 7.00, Below-Viable, high consensus")
        void uniformSevens() {
            var result = composite(List.of(
                    evaluation(HR, 7, 7), evaluation(TECH, 7, 7), evaluation(DESIGN, 7, 7),
                    evaluation(FINANCE, 7, 7), evaluation(CEO, 7, 7), evaluation(TEAM, 7, 7)), List.of());

            assertEquals(7.00, result.weightedScore());
            assertEquals(AssessmentTier.BELOW_VIABLE, result.assessmentTier());
            assertEquals(0.00, result.varianceAcrossPersonas());
            assertEquals(ConsensusLevel.HIGH, result.consensusLevel());
        }

        @Test
        @DisplayName("weights each recomputed average by the persona weight")
        void weightedSum() {
            var result = composite(List.of(evaluation(HR, 9, 9), evaluation(TECH, 6, 6), evaluation(FINANCE, 8, 8),
                    evaluation(DESIGN, 5, 5), evaluation(CEO, 7, 7), evaluation(TEAM, 10, 10)), List.of());

            // 1.8 + 0.9 + 1.6 + 0.75 + 1.4 + 1.0
            assertEquals(7.45, result.weightedScore());
            assertEquals("TEAM", result.strongestPersona());
            assertEquals(10.0, result.strongestScore());
            assertEquals("DESIGN", result.weakestPersona());
            assertEquals(5.0, result.varianceAcrossPersonas());
        }

        @Test
        @DisplayName("missing personas contribute nothing and weights stay as configured")
        void missingNotRenormalized() {
            var alpha = persona("alpha", 0.5, "technical_depth");
            var beta = persona("beta", 0.3, "financial_acumen");
            var missing = List.of(new MissingPersona("gamma", "GAMMA", ErrorKind.TIMEOUT, "No response"));

            var result = composite(List.of(evaluation(alpha, 8), evaluation(beta, 6)), missing);

            assertEquals(5.8, result.weightedScore());
            assertEquals(AssessmentTier.WEAK, result.assessmentTier());
            assertEquals(1, result.missingPersonas().size());
        }

        @Test
        @DisplayName("renormalizes over the present weights when configured")
        void renormalized() {
            properties.setRenormalizeMissingWeights(true);
            var alpha = persona("alpha", 0.5, "technical_depth");
            var beta = persona("beta", 0.3, "financial_acumen");
            var missing = List.of(new MissingPersona("gamma", "GAMMA", ErrorKind.TIMEOUT, "No response"));

            var result = composite(List.of(evaluation(alpha, 8), evaluation(beta, 6)), missing);

            assertEquals(7.25, result.weightedScore());
            assertEquals(AssessmentTier.BELOW_VIABLE, result.assessmentTier());
        }

        @Test
        @DisplayName("raising any criterion score never lowers the composite")
        void monotonic() {
            double previous = Double.NEGATIVE_INFINITY;
            for (int score = 1; score <= 10; score++) {
                double current = composite(List.of(evaluation(HR, 5, score), evaluation(TECH, 6, 6)), List.of())
                        .weightedScore();
                assertTrue(current >= previous, "score " + score + " lowered the composite");
                previous = current;
            }
        }

        @Test
        @DisplayName("the first persona in run order wins ties for strongest and weakest")
        void tiesGoToFirst() {
            var result = composite(List.of(evaluation(TECH, 8, 8), evaluation(HR, 8, 8), evaluation(CEO, 4, 4),
                    evaluation(FINANCE, 4, 4)), List.of());

            assertEquals("TECHNICAL", result.strongestPersona());
            assertEquals("CEO", result.weakestPersona());
            assertEquals(ConsensusLevel.LOW, result.consensusLevel());
        }

        @Test
        @DisplayName("refuses to aggregate zero results")
        void emptyRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> aggregator.composite(List.of(), QualitativeInsights.empty(), List.of()));
        }
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "10.0, EXCEPTIONAL", "8.5, EXCEPTIONAL", "8.49, VIABLE", "8.0, VIABLE", "7.99, BELOW_VIABLE",
            "7.0, BELOW_VIABLE", "6.99, WEAK", "5.0, WEAK", "4.99, POOR", "1.0, POOR", "0.0, POOR"
    })
    @DisplayName("assessment tier boundaries are inclusive on the lower bound")
    void tiers(double score, AssessmentTier expected) {
        assertEquals(expected, AssessmentTier.forScore(score));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"0.0, HIGH", "0.5, HIGH", "0.51, MEDIUM", "1.0, MEDIUM", "1.01, LOW", "6.0, LOW"})
    @DisplayName("consensus level follows the variance")
    void consensus(double variance, ConsensusLevel expected) {
        assertEquals(expected, ConsensusLevel.forVariance(variance));
    }
}
