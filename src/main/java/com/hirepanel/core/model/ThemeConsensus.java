package com.hirepanel.core.model;

import java.io.Serializable;

/**
 * A theme raised by three or more personas, with how closely they agreed.
 *
 * @param theme        coarse theme name (e.g. "Leadership")
 * @param averageScore mean of all scores under the theme, one decimal
 * @param personaCount distinct personas that scored the theme
 * @param label        "Strong consensus", "Moderate consensus" or "Mixed opinions"
 * @param sentiment    overall direction of the average score
 */
public record ThemeConsensus(
    String theme,
    double averageScore,
    int personaCount,
    String label,
    Sentiment sentiment
) implements Serializable {}
