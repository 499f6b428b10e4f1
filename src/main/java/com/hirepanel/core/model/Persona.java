package com.hirepanel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A named evaluator viewpoint with its own criteria, weight, and prompt fragments.
 * <p>
 * Criteria are declared as an ordered list so any persona can carry any set of
 * criterion names; the response schema and report table are both built from it.
 */
public record Persona(
    String key,
    String displayName,
    double weight,
    List<Criterion> criteria,
    List<String> background,
    String evaluationApproach,
    String focus,
    List<String> domainKeywords
) implements Serializable {

    public Persona {
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
        background = background != null ? List.copyOf(background) : List.of();
        domainKeywords = domainKeywords != null ? List.copyOf(domainKeywords) : List.of();
        evaluationApproach = evaluationApproach != null ? evaluationApproach : "";
        focus = focus != null ? focus : "";
    }

    public List<String> criterionNames() {
        return criteria.stream().map(Criterion::name).toList();
    }
}
