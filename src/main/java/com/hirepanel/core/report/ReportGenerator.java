package com.hirepanel.core.report;

import com.hirepanel.core.model.CompositeResult;
import com.hirepanel.core.model.CriterionScore;
import com.hirepanel.core.model.MissingPersona;
import com.hirepanel.core.model.ProcessedPersonaResult;
import com.hirepanel.core.model.QualitativeInsights;
import com.hirepanel.core.model.Sentiment;
import com.hirepanel.core.model.ThemeConsensus;
import com.hirepanel.core.model.ThemedInsight;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders a composite result as a Markdown summary.
 * <p>
 * Output depends only on the arguments (no timestamps, no map iteration order), so
 * rendering the same result twice yields identical text. The breakdown table gets
 * one column per criterion of the widest persona.
 */
@Component
public class ReportGenerator {

    public String render(String candidateName, CompositeResult composite, List<ProcessedPersonaResult> processed) {
        var md = new StringBuilder();
        md.append("# Candidate Evaluation Summary: ").append(candidateName).append("\n\n");

        md.append("## Overall Result\n");
        md.append("**Final Score: ").append(fmt(composite.weightedScore())).append("/10** - ")
                .append(composite.assessmentTier().label()).append("\n\n");

        appendMissing(md, composite.missingPersonas());
        appendBreakdown(md, composite, processed);

        md.append("## Key Insights\n");
        md.append("- **Strongest Evaluation**: ").append(composite.strongestPersona())
                .append(" (").append(fmt(composite.strongestScore())).append("/10)\n");
        md.append("- **Areas of Concern**: ").append(composite.weakestPersona())
                .append(" (").append(fmt(composite.weakestScore())).append("/10)\n");
        md.append("- **Consensus Level**: ").append(composite.consensusLevel().label())
                .append(" (").append(fmt(composite.varianceAcrossPersonas())).append(" point variance)\n");
        md.append("- **Assessment**: ").append(composite.assessmentTier().recommendation()).append("\n\n");

        appendQualitative(md, composite.insights());

        md.append("## Persona Recommendations\n");
        for (ProcessedPersonaResult result : processed) {
            md.append("- **").append(result.persona().displayName()).append("**: ")
                    .append(result.recommendation()).append('\n');
        }
        return md.toString();
    }

    private static void appendMissing(StringBuilder md, List<MissingPersona> missing) {
        if (missing.isEmpty()) {
            return;
        }
        md.append("## Missing Evaluations\n");
        md.append("The following personas did not produce a result and are excluded from the score:\n");
        for (MissingPersona persona : missing) {
            md.append("- **").append(persona.displayName()).append("**: ").append(persona.errorKind());
            if (persona.detail() != null && !persona.detail().isBlank()) {
                md.append(" (").append(persona.detail()).append(')');
            }
            md.append('\n');
        }
        md.append('\n');
    }

    private static void appendBreakdown(StringBuilder md, CompositeResult composite,
                                        List<ProcessedPersonaResult> processed) {
        int columns = processed.stream().mapToInt(r -> r.criterionScores().size()).max().orElse(0);

        md.append("## Detailed Breakdown\n\n");
        md.append("| Persona |");
        for (int i = 1; i <= columns; i++) {
            md.append(" Criterion ").append(i).append(" |");
        }
        md.append(" **Avg** | Weight | **Weighted** |\n");
        md.append("|---------|");
        for (int i = 1; i <= columns; i++) {
            md.append("-------------|");
        }
        md.append("---------|--------|--------------|\n");

        for (ProcessedPersonaResult result : processed) {
            md.append("| ").append(result.persona().displayName()).append(" |");
            List<CriterionScore> scores = result.criterionScores();
            for (int i = 0; i < columns; i++) {
                md.append(' ').append(i < scores.size() ? String.valueOf(scores.get(i).score()) : "").append(" |");
            }
            md.append(" **").append(fmt(result.recomputedAverage())).append("** | ")
                    .append(Math.round(result.weight() * 100)).append("% | **")
                    .append(fmt(result.weightedContribution())).append("** |\n");
        }

        md.append("| |");
        for (int i = 0; i < columns; i++) {
            md.append(" |");
        }
        md.append(" | **Total** | **").append(fmt(composite.weightedScore())).append("** |\n\n");
    }

    private static void appendQualitative(StringBuilder md, QualitativeInsights insights) {
        if (insights == null) {
            return;
        }
        md.append("## Qualitative Insights\n\n");
        appendInsights(md, "### Strengths Highlighted\n", insights.strengths());
        appendInsights(md, "### Concerns Raised\n", insights.concerns());

        if (!insights.specificExamples().isEmpty()) {
            md.append("### Key Achievements/Metrics\n");
            insights.specificExamples().forEach(example -> md.append("- ").append(example).append('\n'));
            md.append('\n');
        }

        if (!insights.consensusThemes().isEmpty()) {
            md.append("### Consensus Themes\n");
            for (ThemeConsensus theme : insights.consensusThemes()) {
                md.append("- ").append(marker(theme.sentiment())).append(" **").append(theme.theme()).append("**: ")
                        .append(theme.label()).append(" (").append(theme.personaCount()).append(" personas, avg ")
                        .append(String.format(Locale.ROOT, "%.1f", theme.averageScore())).append("/10)\n");
            }
            md.append('\n');
        }
    }

    private static void appendInsights(StringBuilder md, String heading, List<ThemedInsight> insights) {
        if (insights.isEmpty()) {
            return;
        }
        md.append(heading);
        for (ThemedInsight insight : insights) {
            md.append("- **").append(insight.theme()).append("**: \"").append(insight.insight())
                    .append("\" (").append(insight.persona()).append(")\n");
        }
        md.append('\n');
    }

    static String marker(Sentiment sentiment) {
        return switch (sentiment) {
            case POSITIVE -> "[+]";
            case NEUTRAL -> "[~]";
            case NEGATIVE -> "[-]";
        };
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
