package com.hirepanel.core.insight;

import com.hirepanel.core.model.Sentiment;

import java.util.List;
import java.util.Locale;

/**
 * Lexicon-based polarity of a reasoning text. Each phrase counts once, however
 * often it occurs; substring matching is intentional ("gap" matches "gaps").
 */
public final class SentimentClassifier {

    static final List<String> POSITIVE_PHRASES = List.of(
            "strong", "excellent", "exceptional", "proven", "successful", "effective",
            "demonstrates", "achieved", "aligns well", "good", "solid", "experience",
            "track record", "proficiency", "relevant", "capabilities", "foundation");

    static final List<String> NEGATIVE_PHRASES = List.of(
            "lacks", "limited", "missing", "insufficient", "concerns", "gap", "weak",
            "no evidence", "does not", "cannot", "unclear", "inadequate", "poor");

    private SentimentClassifier() {}

    public static Sentiment classify(String reasoning) {
        if (reasoning == null || reasoning.isBlank()) {
            return Sentiment.NEUTRAL;
        }
        String text = reasoning.toLowerCase(Locale.ROOT);
        long positive = POSITIVE_PHRASES.stream().filter(text::contains).count();
        long negative = NEGATIVE_PHRASES.stream().filter(text::contains).count();
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        return negative > positive ? Sentiment.NEGATIVE : Sentiment.NEUTRAL;
    }
}
