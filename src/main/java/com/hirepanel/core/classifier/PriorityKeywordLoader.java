package com.hirepanel.core.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.PriorityKeyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the keyword-analysis output: every knockout requirement followed by the
 * top {@value #TOP_SKILLS} ranked skills.
 */
@Component
public class PriorityKeywordLoader {

    private static final Logger log = LoggerFactory.getLogger(PriorityKeywordLoader.class);

    static final int TOP_SKILLS = 5;

    private final ObjectMapper objectMapper;

    public PriorityKeywordLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PriorityKeyword> load(Path keywordAnalysisFile) {
        try {
            return fromJson(objectMapper.readTree(Files.readString(keywordAnalysisFile)));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read keyword analysis " + keywordAnalysisFile, e);
        }
    }

    public List<PriorityKeyword> fromJson(JsonNode analysis) {
        var priorities = new ArrayList<PriorityKeyword>();
        if (analysis == null) {
            return priorities;
        }
        for (JsonNode node : analysis.path("knockout_requirements")) {
            addKeyword(priorities, node);
        }
        int skills = 0;
        for (JsonNode node : analysis.path("skills_ranked")) {
            if (skills++ >= TOP_SKILLS) {
                break;
            }
            addKeyword(priorities, node);
        }
        log.info("Extracted {} priority keywords", priorities.size());
        return priorities;
    }

    private static void addKeyword(List<PriorityKeyword> target, JsonNode node) {
        String kw = node.path("kw").asText("");
        if (!kw.isBlank()) {
            target.add(new PriorityKeyword(kw, node.path("score").asDouble(0.0)));
        }
    }
}
