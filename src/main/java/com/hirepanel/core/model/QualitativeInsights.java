package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

public record QualitativeInsights(
    List<ThemedInsight> strengths,
    List<ThemedInsight> concerns,
    List<String> specificExamples,
    List<ThemeConsensus> consensusThemes
) implements Serializable {

    public QualitativeInsights {
        strengths = List.copyOf(strengths);
        concerns = List.copyOf(concerns);
        specificExamples = List.copyOf(specificExamples);
        consensusThemes = List.copyOf(consensusThemes);
    }

    public static QualitativeInsights empty() {
        return new QualitativeInsights(List.of(), List.of(), List.of(), List.of());
    }
}
