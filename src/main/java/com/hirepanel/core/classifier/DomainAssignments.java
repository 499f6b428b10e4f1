package com.hirepanel.core.classifier;

import com.hirepanel.core.model.PriorityKeyword;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keywords assigned to each persona domain, plus those that matched no domain.
 */
public record DomainAssignments(
    Map<String, List<PriorityKeyword>> byPersona,
    List<PriorityKeyword> unassigned
) {

    public DomainAssignments {
        var copy = new LinkedHashMap<String, List<PriorityKeyword>>();
        byPersona.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        byPersona = Collections.unmodifiableMap(copy);
        unassigned = List.copyOf(unassigned);
    }

    public List<PriorityKeyword> keywordsFor(String personaKey) {
        return byPersona.getOrDefault(personaKey, List.of());
    }
}
