package com.hirepanel.core.model;

import java.io.Serializable;

/**
 * A representative sentence pulled from one criterion's reasoning.
 */
public record ThemedInsight(
    String theme,
    String insight,
    String persona,
    int score
) implements Serializable {}
