package com.hirepanel.core.insight;

import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.model.QualitativeInsights;
import com.hirepanel.core.model.Sentiment;
import com.hirepanel.core.model.ThemeConsensus;
import com.hirepanel.core.model.ThemedInsight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Mines criterion reasoning for strengths, concerns, concrete examples and themes
 * that several personas agree on.
 * <p>
 * Reasoning whose sentiment is neutral never becomes a strength or concern, even
 * with a high score. Within each bucket, near-duplicate insights (word-set Jaccard
 * above {@value #DUPLICATE_SIMILARITY}) collapse to the higher-scoring one.
 */
@Component
public class InsightExtractor {

    private static final Logger log = LoggerFactory.getLogger(InsightExtractor.class);

    static final int STRENGTH_SCORE = 8;
    static final int CONCERN_SCORE = 5;
    static final int MIN_REASONING_LENGTH = 20;
    static final int MIN_SENTENCE_LENGTH = 15;
    static final int MAX_INSIGHTS = 5;
    static final int MAX_EXAMPLES = 5;
    static final int CONSENSUS_PERSONAS = 3;
    static final double DUPLICATE_SIMILARITY = 0.7;

    private static final List<String> POSITIVE_CUES = List.of(
            "strong", "excellent", "exceptional", "proven", "successful", "effective", "demonstrates", "achieved");
    private static final List<String> NEGATIVE_CUES = List.of(
            "lacks", "limited", "missing", "insufficient", "concerns", "gap", "weak", "no evidence");

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");
    private static final Pattern NON_WORD = Pattern.compile("\\W+");

    public QualitativeInsights extract(List<ProcessedPersonaResult> results) {
        var strengths = new ArrayList<ThemedInsight>();
        var concerns = new ArrayList<ThemedInsight>();
        var examples = new LinkedHashSet<String>();
        var themes = new LinkedHashMap<String, List<ThemeScore>>();

        for (ProcessedPersonaResult result : results) {
            String persona = result.persona().displayName();
            for (CriterionScore criterion : result.criterionScores()) {
                String theme = ThemeCatalog.themeFor(criterion.name());
                String reasoning = criterion.reasoning();
                Sentiment sentiment = SentimentClassifier.classify(reasoning);

                if (sentiment != Sentiment.NEUTRAL) {
                    if (criterion.score() >= STRENGTH_SCORE || sentiment == Sentiment.POSITIVE) {
                        keyInsight(reasoning, POSITIVE_CUES).ifPresent(
                                text -> strengths.add(new ThemedInsight(theme, text, persona, criterion.score())));
                    } else if (criterion.score() <= CONCERN_SCORE) {
                        keyInsight(reasoning, NEGATIVE_CUES).ifPresent(
                                text -> concerns.add(new ThemedInsight(theme, text, persona, criterion.score())));
                    }
                }

                examples.addAll(ExampleMiner.mine(reasoning));
                themes.computeIfAbsent(theme, k -> new ArrayList<>()).add(new ThemeScore(persona, criterion.score()));
            }
        }

        var insights = new QualitativeInsights(
                dedupAndRank(strengths),
                dedupAndRank(concerns),
                examples.stream().limit(MAX_EXAMPLES).toList(),
                consensusThemes(themes));
        log.debug("Extracted {} strength(s), {} concern(s), {} example(s), {} consensus theme(s)",
                insights.strengths().size(), insights.concerns().size(),
                insights.specificExamples().size(), insights.consensusThemes().size());
        return insights;
    }

    /**
     * Picks the first sentence carrying one of the cue words, else the first sentence.
     */
    static Optional<String> keyInsight(String reasoning, List<String> cues) {
        if (reasoning == null || reasoning.length() < MIN_REASONING_LENGTH) {
            return Optional.empty();
        }
        List<String> sentences = Arrays.stream(SENTENCE_BREAK.split(reasoning))
                .map(String::trim)
                .filter(s -> s.length() > MIN_SENTENCE_LENGTH)
                .toList();
        return sentences.stream()
                .filter(s -> {
                    String lower = s.toLowerCase(Locale.ROOT);
                    return cues.stream().anyMatch(lower::contains);
                })
                .findFirst()
                .or(() -> sentences.stream().findFirst());
    }

    static List<ThemedInsight> dedupAndRank(List<ThemedInsight> insights) {
        var ranked = new ArrayList<>(insights);
        ranked.sort(Comparator.comparingInt(ThemedInsight::score).reversed());
        var unique = new ArrayList<ThemedInsight>();
        for (ThemedInsight candidate : ranked) {
            boolean duplicate = unique.stream()
                    .anyMatch(kept -> similarity(kept.insight(), candidate.insight()) > DUPLICATE_SIMILARITY);
            if (!duplicate) {
                unique.add(candidate);
            }
            if (unique.size() == MAX_INSIGHTS) {
                break;
            }
        }
        return unique;
    }

    /** Jaccard similarity of the lower-cased word sets. */
    static double similarity(String a, String b) {
        Set<String> wordsA = wordSet(a);
        Set<String> wordsB = wordSet(b);
        if (wordsA.isEmpty() && wordsB.isEmpty()) {
            return 1.0;
        }
        var intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        var union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> wordSet(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
    }

    static List<ThemeConsensus> consensusThemes(Map<String, List<ThemeScore>> themes) {
        var consensus = new ArrayList<ThemeConsensus>();
        themes.forEach((theme, scores) -> {
            long personas = scores.stream().map(ThemeScore::persona).distinct().count();
            if (personas < CONSENSUS_PERSONAS) {
                return;
            }
            var stats = scores.stream().mapToInt(ThemeScore::score).summaryStatistics();
            double average = Math.round(stats.getAverage() * 10) / 10.0;
            int spread = stats.getMax() - stats.getMin();
            String label = spread <= 1 ? "Strong consensus" : spread <= 2 ? "Moderate consensus" : "Mixed opinions";
            Sentiment sentiment = stats.getAverage() >= 7 ? Sentiment.POSITIVE
                    : stats.getAverage() >= 5 ? Sentiment.NEUTRAL : Sentiment.NEGATIVE;
            consensus.add(new ThemeConsensus(theme, average, (int) personas, label, sentiment));
        });
        consensus.sort(Comparator.comparingInt(ThemeConsensus::personaCount).reversed());
        return consensus;
    }

    record ThemeScore(String persona, int score) {}
}
