package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.ErrorKind;
import com.hirepanel.core.model.Persona;
import com.hirepanel.core.model.PersonaEvaluation;

import java.util.ArrayList;

/**
 * Maps a validated payload onto the persona's declared criteria, in declaration order.
 * Extra criteria in the payload are ignored; a missing or out-of-range one is a
 * schema violation.
 */
public final class EvaluationResponseMapper {

    static final String UNKNOWN_RECOMMENDATION = "Unknown";

    private EvaluationResponseMapper() {}

    public static PersonaEvaluation toEvaluation(Persona persona, JsonNode payload) {
        JsonNode scores = payload.path("scores");
        var criterionScores = new ArrayList<CriterionScore>();
        for (Criterion criterion : persona.criteria()) {
            JsonNode entry = scores.path(criterion.name());
            JsonNode score = entry.path("score");
            if (!score.isNumber()) {
                throw new ModelCallException(ErrorKind.SCHEMA_VIOLATION,
                        "Missing score for criterion '" + criterion.name() + "'");
            }
            int value = (int) Math.round(score.asDouble());
            if (value < 1 || value > 10) {
                throw new ModelCallException(ErrorKind.SCHEMA_VIOLATION,
                        "Score " + value + " for criterion '" + criterion.name() + "' is outside 1..10");
            }
            criterionScores.add(new CriterionScore(criterion.name(), value, entry.path("reasoning").asText("")));
        }
        if (criterionScores.isEmpty()) {
            throw new ModelCallException(ErrorKind.SCHEMA_VIOLATION,
                    "Persona " + persona.key() + " declares no criteria");
        }

        JsonNode overall = payload.path("overall_assessment");
        JsonNode personaScore = overall.path("persona_score");
        Double reported = personaScore.isNumber() ? personaScore.asDouble() : null;
        String recommendation = overall.path("recommendation").asText(UNKNOWN_RECOMMENDATION);
        return new PersonaEvaluation(persona, criterionScores, reported, recommendation);
    }
}
