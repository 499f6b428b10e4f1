package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One named dimension a persona scores the candidate on.
 *
 * @param name        machine key used in the response schema (e.g. "technical_depth")
 * @param title       human-readable heading used in the prompt
 * @param description what the criterion measures
 * @param bullets     guidance bullets rendered under the heading
 */
public record Criterion(
    String name,
    String title,
    String description,
    List<String> bullets
) implements Serializable {

    public Criterion {
        bullets = bullets != null ? List.copyOf(bullets) : List.of();
    }
}
