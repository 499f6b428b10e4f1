package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A parsed, schema-valid backend response.
 *
 * @param json      the JSON object extracted from the response
 * @param rawText   the response text as received, for audit logging
 * @param elapsedMs wall-clock time of the call
 */
public record RawModelPayload(
    JsonNode json,
    String rawText,
    long elapsedMs
) {}
