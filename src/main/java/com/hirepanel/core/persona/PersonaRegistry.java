package com.hirepanel.core.persona;

import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.Persona;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated set of enabled personas for one run.
 * <p>
 * Iteration order is the configured order; the domain classifier relies on it
 * to break similarity ties.
 */
public final class PersonaRegistry {

    static final double WEIGHT_SUM_TOLERANCE = 0.01;

    private final List<Persona> personas;
    private final Map<String, Persona> byKey;

    private PersonaRegistry(List<Persona> personas) {
        this.personas = List.copyOf(personas);
        var map = new LinkedHashMap<String, Persona>();
        for (Persona p : personas) {
            map.put(p.key(), p);
        }
        this.byKey = map;
    }

    /**
     * Validates and wraps the given personas.
     *
     * @throws PersonaConfigurationException if keys repeat, a persona has no criteria,
     *         criterion names repeat, a weight lies outside 0..1, or weights do not sum to 1
     */
    public static PersonaRegistry of(List<Persona> personas) {
        if (personas == null || personas.isEmpty()) {
            throw new PersonaConfigurationException("No personas enabled");
        }
        Set<String> keys = new HashSet<>();
        double weightSum = 0.0;
        for (Persona persona : personas) {
            if (persona.key() == null || persona.key().isBlank()) {
                throw new PersonaConfigurationException("Persona with blank key");
            }
            if (!keys.add(persona.key())) {
                throw new PersonaConfigurationException("Duplicate persona key: " + persona.key());
            }
            if (persona.weight() < 0.0 || persona.weight() > 1.0 || Double.isNaN(persona.weight())) {
                throw new PersonaConfigurationException("Persona " + persona.key()
                        + " has weight " + persona.weight() + " outside 0..1");
            }
            if (persona.criteria().isEmpty()) {
                throw new PersonaConfigurationException("Persona " + persona.key() + " declares no criteria");
            }
            Set<String> criterionNames = new HashSet<>();
            for (Criterion c : persona.criteria()) {
                if (c.name() == null || c.name().isBlank()) {
                    throw new PersonaConfigurationException("Persona " + persona.key() + " has a criterion without a name");
                }
                if (!criterionNames.add(c.name())) {
                    throw new PersonaConfigurationException("Persona " + persona.key()
                            + " repeats criterion " + c.name());
                }
            }
            weightSum += persona.weight();
        }
        if (Math.abs(weightSum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new PersonaConfigurationException(String.format(
                    "Persona weights sum to %.3f, expected 1.0", weightSum));
        }
        return new PersonaRegistry(personas);
    }

    public List<Persona> personas() {
        return personas;
    }

    public Optional<Persona> find(String key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public int size() {
        return personas.size();
    }

    /**
     * Reference keyword sets per persona key, in enumeration order.
     */
    public Map<String, List<String>> domainTaxonomy() {
        var taxonomy = new LinkedHashMap<String, List<String>>();
        for (Persona p : personas) {
            taxonomy.put(p.key(), p.domainKeywords());
        }
        return taxonomy;
    }
}
