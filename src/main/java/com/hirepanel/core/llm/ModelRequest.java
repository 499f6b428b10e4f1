package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * One outbound call. The timeout is enforced by the caller, which owns the thread
 * the call runs on.
 */
public record ModelRequest(
    String prompt,
    JsonNode responseSchema,
    String modelName,
    double temperature,
    Duration timeout
) {}
