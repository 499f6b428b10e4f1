package com.hirepanel.core.insight;

import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.Persona;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.model.QualitativeInsights;
import com.hirepanel.core.model.Sentiment;
import com.hirepanel.core.model.ThemeConsensus;
import com.hirepanel.core.model.ThemedInsight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static com.hirepanel.core.TestData.persona;
import static org.junit.jupiter.api.Assertions.*;

class InsightExtractorTest {

    private final InsightExtractor extractor = new InsightExtractor();

    private static ProcessedPersonaResult result(Persona persona, CriterionScore... scores) {
        double average = List.of(scores).stream().mapToInt(CriterionScore::score).average().orElse(0);
        return new ProcessedPersonaResult(persona, List.of(scores), average, null, persona.weight(), "Advance");
    }

    @Nested
    @DisplayName("strengths and concerns")
    class StrengthsAndConcerns {

        @Test
        @DisplayName("positive reasoning on a high score becomes a strength with the cue sentence")
        void strength() {
            var tech = persona("technical", 0.15, "technical_depth");
            QualitativeInsights insights = extractor.extract(List.of(result(tech,
                    new CriterionScore("technical_depth", 9,
                            "Led the platform team for six years. Demonstrates strong ownership of delivery outcomes."))));

            assertEquals(1, insights.strengths().size());
            ThemedInsight strength = insights.strengths().get(0);
            assertEquals("Technical", strength.theme());
            assertEquals("Demonstrates strong ownership of delivery outcomes", strength.insight());
            assertEquals("TECHNICAL", strength.persona());
            assertEquals(9, strength.score());
            assertTrue(insights.concerns().isEmpty());
        }

        @Test
        @DisplayName("negative reasoning on a low score becomes a concern")
        void concern() {
            var finance = persona("finance", 0.2, "financial_acumen");
            QualitativeInsights insights = extractor.extract(List.of(result(finance,
                    new CriterionScore("financial_acumen", 4,
                            "Limited exposure to budgeting. Lacks evidence of P&L ownership at scale."))));

            assertEquals(1, insights.concerns().size());
            assertEquals("Limited exposure to budgeting", insights.concerns().get(0).insight());
            assertEquals("Business Acumen", insights.concerns().get(0).theme());
        }

        @Test
        @DisplayName("neutral reasoning is dropped even with a high score")
        void neutralDropped() {
            var hr = persona("hr", 0.2, "experience_match");
            QualitativeInsights insights = extractor.extract(List.of(result(hr,
                    new CriterionScore("experience_match", 9, "The resume lists several roles across four companies."))));

            assertTrue(insights.strengths().isEmpty());
            assertTrue(insights.concerns().isEmpty());
        }

        @Test
        @DisplayName("negative reasoning on a middling score is neither strength nor concern")
        void middlingNegative() {
            var hr = persona("hr", 0.2, "experience_match");
            QualitativeInsights insights = extractor.extract(List.of(result(hr,
                    new CriterionScore("experience_match", 6, "Limited scope in recent roles and missing hiring data."))));

            assertTrue(insights.strengths().isEmpty());
            assertTrue(insights.concerns().isEmpty());
        }

        @Test
        @DisplayName("short reasoning yields no insight")
        void shortReasoning() {
            assertEquals(Optional.empty(), InsightExtractor.keyInsight("Strong fit.", List.of("strong")));
        }

        @Test
        @DisplayName("falls back to the first sentence when no cue word appears")
        void firstSentenceFallback() {
            assertEquals(Optional.of("Owns the quarterly planning cycle"),
                    InsightExtractor.keyInsight("Owns the quarterly planning cycle. Presents to the board.",
                            List.of("excellent")));
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        @Test
        @DisplayName("near-duplicates collapse to the higher-scoring insight")
        void keepsHigherScore() {
            var ranked = InsightExtractor.dedupAndRank(List.of(
                    new ThemedInsight("Technical", "Demonstrates strong ownership of delivery outcomes", "A", 8),
                    new ThemedInsight("Technical", "Demonstrates strong ownership of delivery outcomes across teams",
                            "B", 9)));

            assertEquals(1, ranked.size());
            assertEquals("B", ranked.get(0).persona());
        }

        @Test
        @DisplayName("keeps at most five, best first")
        void capsAtFive() {
            var insights = new ArrayList<ThemedInsight>();
            String[] texts = {"alpha bravo", "charlie delta", "echo foxtrot", "golf hotel", "india juliet",
                    "kilo lima", "mike november"};
            for (int i = 0; i < texts.length; i++) {
                insights.add(new ThemedInsight("Other", texts[i], "P", 3 + i));
            }

            var ranked = InsightExtractor.dedupAndRank(insights);

            assertEquals(InsightExtractor.MAX_INSIGHTS, ranked.size());
            assertEquals("mike november", ranked.get(0).insight());
        }

        @Test
        @DisplayName("similarity is the Jaccard index of the word sets")
        void similarity() {
            assertEquals(1.0, InsightExtractor.similarity("Strong leader", "strong LEADER."));
            assertEquals(0.5, InsightExtractor.similarity("strong leader", "strong manager leader mentor"));
            assertEquals(0.0, InsightExtractor.similarity("budget", "hiring"));
        }
    }

    @Nested
    @DisplayName("examples")
    class Examples {

        @Test
        @DisplayName("are unique and capped at five across the report")
        void cappedAcrossReport() {
            var p = persona("p", 0.5, "a", "b", "c");
            QualitativeInsights insights = extractor.extract(List.of(result(p,
                    new CriterionScore("a", 7, "Grew revenue 10%, 20% and 30% year over year."),
                    new CriterionScore("b", 7, "Managed $500K across 40 engineers, also 20% churn cut."),
                    new CriterionScore("c", 7, "Shipped at Stripe and Figma."))));

            assertEquals(List.of("10%", "20%", "30%", "$500K", "40 engineers"), insights.specificExamples());
        }
    }

    @Nested
    @DisplayName("consensus themes")
    class ConsensusThemes {

        @Test
        @DisplayName("a theme scored by three personas is reported with label and sentiment")
        void threePersonas() {
            QualitativeInsights insights = extractor.extract(List.of(
                    result(persona("technical", 0.15, "technical_leadership"),
                            new CriterionScore("technical_leadership", 8, "")),
                    result(persona("design", 0.15, "cross_functional_leadership"),
                            new CriterionScore("cross_functional_leadership", 8, "")),
                    result(persona("team", 0.1, "practical_leadership"),
                            new CriterionScore("practical_leadership", 7, ""))));

            assertEquals(1, insights.consensusThemes().size());
            ThemeConsensus theme = insights.consensusThemes().get(0);
            assertEquals("Leadership", theme.theme());
            assertEquals(7.7, theme.averageScore());
            assertEquals(3, theme.personaCount());
            assertEquals("Strong consensus", theme.label());
            assertEquals(Sentiment.POSITIVE, theme.sentiment());
        }

        @Test
        @DisplayName("counts distinct personas, not criteria")
        void distinctPersonas() {
            var scores = new LinkedHashMap<String, List<InsightExtractor.ThemeScore>>();
            scores.put("Leadership", List.of(
                    new InsightExtractor.ThemeScore("CEO", 9),
                    new InsightExtractor.ThemeScore("CEO", 3),
                    new InsightExtractor.ThemeScore("TEAM", 6)));

            assertTrue(InsightExtractor.consensusThemes(scores).isEmpty());
        }

        @Test
        @DisplayName("labels widen with the score spread")
        void labels() {
            var scores = new LinkedHashMap<String, List<InsightExtractor.ThemeScore>>();
            scores.put("Strategy", List.of(new InsightExtractor.ThemeScore("A", 6),
                    new InsightExtractor.ThemeScore("B", 4), new InsightExtractor.ThemeScore("C", 5)));
            scores.put("Management", List.of(new InsightExtractor.ThemeScore("A", 2),
                    new InsightExtractor.ThemeScore("B", 6), new InsightExtractor.ThemeScore("C", 4)));

            var themes = InsightExtractor.consensusThemes(scores);

            assertEquals("Moderate consensus", themes.get(0).label());
            assertEquals(Sentiment.NEUTRAL, themes.get(0).sentiment());
            assertEquals("Mixed opinions", themes.get(1).label());
            assertEquals(Sentiment.NEGATIVE, themes.get(1).sentiment());
        }
    }

    @Test
    @DisplayName("criteria outside the catalog fall under Other")
    void unknownTheme() {
        assertEquals("Other", ThemeCatalog.themeFor("juggling"));
        assertEquals("Strategy", ThemeCatalog.themeFor("growth_strategy"));
    }
}
