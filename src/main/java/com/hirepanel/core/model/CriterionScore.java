package com.hirepanel.core.model;

import java.io.Serializable;

/**
 * A model-produced score (1-10) for a single criterion, with its free-text reasoning.
 */
public record CriterionScore(
    String name,
    int score,
    String reasoning
) implements Serializable {}
