package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.ErrorKind;
import com.hirepanel.core.model.Persona;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.hirepanel.core.TestData.persona;
import static org.junit.jupiter.api.Assertions.*;

class EvaluationResponseMapperTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Persona persona = persona("ceo", 0.2, "strategic_vision_execution", "organizational_impact");

    @Test
    @DisplayName("maps criteria in declaration order, ignoring extras")
    void mapsInDeclarationOrder() throws Exception {
        var evaluation = EvaluationResponseMapper.toEvaluation(persona, mapper.readTree("""
                {"scores": {"organizational_impact": {"score": 6, "reasoning": "Limited scope."},
                            "bonus_criterion": {"score": 10, "reasoning": "n/a"},
                            "strategic_vision_execution": {"score": 8, "reasoning": "Proven strategist."}},
                 "overall_assessment": {"persona_score": 9.5, "recommendation": "Advance to final round"}}
                """));

        assertEquals("strategic_vision_execution", evaluation.criterionScores().get(0).name());
        assertEquals(8, evaluation.criterionScores().get(0).score());
        assertEquals("Limited scope.", evaluation.criterionScores().get(1).reasoning());
        assertEquals(2, evaluation.criterionScores().size());
        assertEquals(9.5, evaluation.modelReportedAverage());
        assertEquals("Advance to final round", evaluation.modelRecommendation());
    }

    @Test
    @DisplayName("a missing criterion is a schema violation")
    void missingCriterion() throws Exception {
        var ex = assertThrows(ModelCallException.class, () -> EvaluationResponseMapper.toEvaluation(persona,
                mapper.readTree("{\"scores\": {\"strategic_vision_execution\": {\"score\": 8}}}")));

        assertEquals(ErrorKind.SCHEMA_VIOLATION, ex.kind());
        assertTrue(ex.getMessage().contains("organizational_impact"));
    }

    @Test
    @DisplayName("tolerates a missing overall assessment")
    void missingOverall() throws Exception {
        var evaluation = EvaluationResponseMapper.toEvaluation(persona, mapper.readTree("""
                {"scores": {"strategic_vision_execution": {"score": 8, "reasoning": "a"},
                            "organizational_impact": {"score": 7, "reasoning": "b"}}}
                """));

        assertNull(evaluation.modelReportedAverage());
        assertEquals("Unknown", evaluation.modelRecommendation());
    }
}
