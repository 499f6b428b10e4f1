package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a payload against the subset of JSON Schema the evaluation schemas use:
 * {@code type}, {@code properties}, {@code required}, {@code minimum} and
 * {@code maximum}. Length limits are left to the backend.
 */
public final class ResponseSchemaValidator {

    private ResponseSchemaValidator() {}

    /**
     * @return human-readable violations, empty when the payload conforms
     */
    public static List<String> validate(JsonNode schema, JsonNode value) {
        var violations = new ArrayList<String>();
        validate(schema, value, "$", violations);
        return violations;
    }

    private static void validate(JsonNode schema, JsonNode value, String path, List<String> violations) {
        if (schema == null || schema.isMissingNode()) {
            return;
        }
        String type = schema.path("type").asText("");
        if (!type.isEmpty() && !matchesType(type, value)) {
            violations.add(path + ": expected " + type + " but was " + describe(value));
            return;
        }

        if (value.isNumber()) {
            JsonNode min = schema.get("minimum");
            if (min != null && value.asDouble() < min.asDouble()) {
                violations.add(path + ": " + value.asText() + " is below minimum " + min.asText());
            }
            JsonNode max = schema.get("maximum");
            if (max != null && value.asDouble() > max.asDouble()) {
                violations.add(path + ": " + value.asText() + " is above maximum " + max.asText());
            }
        }

        if (value.isObject()) {
            for (JsonNode required : schema.path("required")) {
                if (!value.hasNonNull(required.asText())) {
                    violations.add(path + ": missing required property '" + required.asText() + "'");
                }
            }
            var properties = schema.path("properties").fields();
            while (properties.hasNext()) {
                var property = properties.next();
                JsonNode child = value.get(property.getKey());
                if (child != null && !child.isNull()) {
                    validate(property.getValue(), child, path + "." + property.getKey(), violations);
                }
            }
        }
    }

    private static boolean matchesType(String type, JsonNode value) {
        return switch (type) {
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber()
                    || (value.isNumber() && value.asDouble() == Math.rint(value.asDouble()));
            case "boolean" -> value.isBoolean();
            default -> true;
        };
    }

    private static String describe(JsonNode value) {
        return value == null ? "missing" : value.getNodeType().name().toLowerCase();
    }
}
