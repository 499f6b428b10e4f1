package com.hirepanel.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.ErrorKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of model output. Reasoning models may wrap the answer in
 * {@code <think>} blocks or markdown fences, so three shapes are accepted: bare JSON,
 * a {@code ```json} fenced block, and the span from the first '{' to the last '}'.
 */
public final class JsonResponseExtractor {

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>[\\s\\S]*?</think>");
    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```");

    private JsonResponseExtractor() {}

    public static JsonNode extract(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) {
            throw new ModelCallException(ErrorKind.MALFORMED_JSON, "Model returned empty content");
        }
        String clean = THINK_BLOCK.matcher(text).replaceAll("").trim();

        if (clean.startsWith("{") && clean.endsWith("}")) {
            JsonNode direct = tryParse(mapper, clean);
            if (direct != null) {
                return direct;
            }
        }

        Matcher fenced = FENCED_JSON.matcher(clean);
        if (fenced.find()) {
            JsonNode node = tryParse(mapper, fenced.group(1));
            if (node != null) {
                return node;
            }
        }

        int start = clean.indexOf('{');
        int end = clean.lastIndexOf('}');
        if (start != -1 && end > start) {
            JsonNode node = tryParse(mapper, clean.substring(start, end + 1));
            if (node != null) {
                return node;
            }
        }
        throw new ModelCallException(ErrorKind.MALFORMED_JSON, "No valid JSON object found in model response ("
                + clean.length() + " chars)");
    }

    private static JsonNode tryParse(ObjectMapper mapper, String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
