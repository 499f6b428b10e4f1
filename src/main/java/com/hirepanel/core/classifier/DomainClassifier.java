package com.hirepanel.core.classifier;

import com.hirepanel.core.model.PriorityKeyword;
import com.hirepanel.core.persona.PersonaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assigns priority keywords to persona domains by lexical word overlap.
 * <p>
 * Similarity is a word-substring containment ratio, a stand-in until an
 * embedding-based measure replaces it. A keyword goes to the single domain with the
 * highest similarity if that similarity reaches {@link #ASSIGNMENT_THRESHOLD}; ties
 * go to the first domain in registry order. Unmatched keywords are only left out of
 * prompt context.
 */
@Component
public class DomainClassifier {

    private static final Logger log = LoggerFactory.getLogger(DomainClassifier.class);

    public static final double ASSIGNMENT_THRESHOLD = 0.25;

    public DomainAssignments assign(List<PriorityKeyword> keywords, PersonaRegistry registry) {
        Map<String, List<String>> taxonomy = registry.domainTaxonomy();
        var byPersona = new LinkedHashMap<String, List<PriorityKeyword>>();
        taxonomy.keySet().forEach(key -> byPersona.put(key, new ArrayList<>()));
        var unassigned = new ArrayList<PriorityKeyword>();

        for (PriorityKeyword keyword : keywords) {
            String bestDomain = null;
            double bestSimilarity = 0.0;
            for (var entry : taxonomy.entrySet()) {
                double similarity = similarity(keyword.keyword(), entry.getValue());
                // strict '>' keeps the earliest domain on ties
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestDomain = entry.getKey();
                }
            }
            if (bestDomain != null && bestSimilarity >= ASSIGNMENT_THRESHOLD) {
                byPersona.get(bestDomain).add(keyword);
                log.debug("Keyword '{}' -> {} (similarity {})", keyword.keyword(), bestDomain,
                        String.format(Locale.ROOT, "%.2f", bestSimilarity));
            } else {
                unassigned.add(keyword);
                log.debug("Keyword '{}' matched no domain (best {})", keyword.keyword(),
                        String.format(Locale.ROOT, "%.2f", bestSimilarity));
            }
        }
        return new DomainAssignments(byPersona, unassigned);
    }

    /**
     * Best word-overlap similarity between a keyword and any phrase of a domain.
     * A keyword word counts as overlapping when it contains, or is contained in, some
     * word of the domain phrase; the count is divided by the longer word list.
     */
    public static double similarity(String keyword, List<String> domainKeywords) {
        if (keyword == null || keyword.isBlank()) {
            return 0.0;
        }
        String[] keywordWords = words(keyword);
        double max = 0.0;
        for (String domainKeyword : domainKeywords) {
            String[] domainWords = words(domainKeyword);
            if (domainWords.length == 0) {
                continue;
            }
            int overlap = 0;
            for (String word : keywordWords) {
                for (String domainWord : domainWords) {
                    if (word.contains(domainWord) || domainWord.contains(word)) {
                        overlap++;
                        break;
                    }
                }
            }
            double similarity = (double) overlap / Math.max(keywordWords.length, domainWords.length);
            max = Math.max(max, similarity);
        }
        return max;
    }

    /**
     * Renders the persona's share of priority keywords as a prompt section,
     * or an empty string when none were assigned.
     */
    public String contextPrompt(List<PriorityKeyword> keywords) {
        if (keywords.isEmpty()) {
            return "";
        }
        String keywordList = keywords.stream()
                .map(k -> "\"" + k.keyword() + "\"")
                .collect(Collectors.joining(", "));
        return """

                ## Priority Focus Areas:
                Pay special attention to how the candidate addresses these key requirements: %s

                ## Company Context Considerations:
                Consider the size, stage, and industry context of this organization when evaluating:
                - Does the candidate's experience scale match your company's current needs?
                - Are their past company contexts relevant preparation for your organizational complexity?
                - Do their leadership experiences align with your current operational requirements?
                """.formatted(keywordList);
    }

    private static String[] words(String text) {
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
}
