package com.hirepanel.core.model;

import java.io.Serializable;

/**
 * A ranked priority keyword produced by the keyword-analysis collaborator.
 */
public record PriorityKeyword(
    String keyword,
    double score
) implements Serializable {}
