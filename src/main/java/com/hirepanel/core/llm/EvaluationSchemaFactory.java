package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.Persona;
import org.springframework.stereotype.Component;

/**
 * Builds the JSON schema that constrains a persona's response: one required
 * {@code {score, reasoning}} object per declared criterion, plus the model's own
 * overall assessment.
 */
@Component
public class EvaluationSchemaFactory {

    static final int MAX_REASONING_LENGTH = 300;
    static final int MAX_RECOMMENDATION_LENGTH = 200;

    private final ObjectMapper objectMapper;

    public EvaluationSchemaFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode schemaFor(Persona persona) {
        ObjectNode criteriaProperties = objectMapper.createObjectNode();
        for (Criterion criterion : persona.criteria()) {
            ObjectNode criterionSchema = criteriaProperties.putObject(criterion.name());
            criterionSchema.put("type", "object");
            ObjectNode props = criterionSchema.putObject("properties");
            props.putObject("score").put("type", "integer").put("minimum", 1).put("maximum", 10);
            props.putObject("reasoning").put("type", "string").put("maxLength", MAX_REASONING_LENGTH);
            criterionSchema.putArray("required").add("score").add("reasoning");
        }

        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");

        ObjectNode scores = properties.putObject("scores");
        scores.put("type", "object");
        scores.set("properties", criteriaProperties);
        scores.put("additionalProperties", false);
        var required = scores.putArray("required");
        persona.criterionNames().forEach(required::add);

        ObjectNode overall = properties.putObject("overall_assessment");
        overall.put("type", "object");
        ObjectNode overallProps = overall.putObject("properties");
        overallProps.putObject("persona_score").put("type", "number").put("minimum", 1.0).put("maximum", 10.0);
        overallProps.putObject("recommendation").put("type", "string").put("maxLength", MAX_RECOMMENDATION_LENGTH);
        overall.putArray("required").add("persona_score").add("recommendation");

        schema.putArray("required").add("scores").add("overall_assessment");
        return schema;
    }
}
