package com.hirepanel.core.classifier;

import com.hirepanel.core.model.PriorityKeyword;
import com.hirepanel.core.persona.PersonaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hirepanel.core.TestData.persona;
import static org.junit.jupiter.api.Assertions.*;

class DomainClassifierTest {

    private DomainClassifier classifier;
    private PersonaRegistry registry;

    @BeforeEach
    void setUp() {
        classifier = new DomainClassifier();
        registry = PersonaRegistry.of(List.of(
                persona("technical", "Director of Engineering", 0.4,
                        List.of("software development", "system design", "team management"), "technical_depth"),
                persona("finance", "Finance Director", 0.3,
                        List.of("budget management", "revenue growth"), "financial_acumen"),
                persona("team", "Senior Product Manager", 0.3,
                        List.of("mentorship", "team management"), "management_mentorship")));
    }

    private static PriorityKeyword kw(String keyword) {
        return new PriorityKeyword(keyword, 1.0);
    }

    @Nested
    @DisplayName("similarity")
    class Similarity {

        @Test
        @DisplayName("identical phrases score 1")
        void identical() {
            assertEquals(1.0, DomainClassifier.similarity("System Design", List.of("system design")));
        }

        @Test
        @DisplayName("divides overlap by the longer word list")
        void dividesByLongerList() {
            assertEquals(0.5, DomainClassifier.similarity("budget", List.of("budget management")));
        }

        @Test
        @DisplayName("counts substring containment in either direction")
        void substringContainment() {
            // "mentor" is contained in "mentorship"
            assertEquals(1.0, DomainClassifier.similarity("mentor", List.of("mentorship")));
        }

        @Test
        @DisplayName("takes the best phrase of the domain")
        void bestPhrase() {
            assertEquals(1.0, DomainClassifier.similarity("revenue growth",
                    List.of("budget management", "revenue growth")));
        }

        @Test
        @DisplayName("blank keyword scores 0")
        void blankKeyword() {
            assertEquals(0.0, DomainClassifier.similarity("  ", List.of("anything")));
        }
    }

    @Nested
    @DisplayName("assign")
    class Assign {

        @Test
        @DisplayName("assigns each keyword to its most similar domain")
        void assignsToBestDomain() {
            var assignments = classifier.assign(List.of(kw("software development"), kw("budget")), registry);

            assertEquals(List.of(kw("software development")), assignments.keywordsFor("technical"));
            assertEquals(List.of(kw("budget")), assignments.keywordsFor("finance"));
            assertTrue(assignments.keywordsFor("team").isEmpty());
            assertTrue(assignments.unassigned().isEmpty());
        }

        @Test
        @DisplayName("ties go to the first domain in registry order")
        void tiesGoToFirstDomain() {
            var assignments = classifier.assign(List.of(kw("team management")), registry);

            assertEquals(List.of(kw("team management")), assignments.keywordsFor("technical"));
            assertTrue(assignments.keywordsFor("team").isEmpty());
        }

        @Test
        @DisplayName("similarity of exactly 0.25 is assigned")
        void thresholdInclusive() {
            var assignments = classifier.assign(List.of(kw("budget qq ww kk")), registry);

            assertEquals(1, assignments.keywordsFor("finance").size());
        }

        @Test
        @DisplayName("keywords below the threshold are dropped from every domain")
        void belowThresholdUnassigned() {
            var assignments = classifier.assign(List.of(kw("budget qq ww kk vv"), kw("underwater basket")), registry);

            assertEquals(2, assignments.unassigned().size());
            assignments.byPersona().values().forEach(list -> assertTrue(list.isEmpty()));
        }

        @Test
        @DisplayName("each keyword lands in at most one domain")
        void atMostOneDomain() {
            var keywords = List.of(kw("team management"), kw("mentorship"), kw("revenue growth"), kw("system design"));
            var assignments = classifier.assign(keywords, registry);

            int total = assignments.byPersona().values().stream().mapToInt(List::size).sum()
                    + assignments.unassigned().size();
            assertEquals(keywords.size(), total);
        }
    }

    @Nested
    @DisplayName("contextPrompt")
    class ContextPrompt {

        @Test
        @DisplayName("is empty when no keyword was assigned")
        void emptyWhenNoKeywords() {
            assertEquals("", classifier.contextPrompt(List.of()));
        }

        @Test
        @DisplayName("quotes the assigned keywords under the focus heading")
        void listsKeywords() {
            String context = classifier.contextPrompt(List.of(kw("budget"), kw("roi")));

            assertTrue(context.contains("## Priority Focus Areas:"));
            assertTrue(context.contains("\"budget\", \"roi\""));
            assertTrue(context.contains("## Company Context Considerations:"));
        }
    }
}
