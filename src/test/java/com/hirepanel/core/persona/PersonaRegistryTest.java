package com.hirepanel.core.persona;

import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.Persona;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hirepanel.core.TestData.persona;
import static org.junit.jupiter.api.Assertions.*;

class PersonaRegistryTest {

    @Test
    @DisplayName("accepts weights within the rounding tolerance")
    void acceptsToleratedWeightSum() {
        var registry = PersonaRegistry.of(List.of(
                persona("a", 0.333, "experience_match"),
                persona("b", 0.333, "technical_depth"),
                persona("c", 0.333, "financial_acumen")));

        assertEquals(3, registry.size());
    }

    @Test
    @DisplayName("rejects an empty persona list")
    void rejectsEmpty() {
        assertThrows(PersonaConfigurationException.class, () -> PersonaRegistry.of(List.of()));
    }

    @Test
    @DisplayName("rejects duplicate persona keys")
    void rejectsDuplicateKeys() {
        var ex = assertThrows(PersonaConfigurationException.class, () -> PersonaRegistry.of(List.of(
                persona("a", 0.5, "x"),
                persona("a", 0.5, "y"))));
        assertTrue(ex.getMessage().contains("Duplicate"));
    }

    @Test
    @DisplayName("rejects a weight outside 0..1")
    void rejectsWeightOutOfRange() {
        assertThrows(PersonaConfigurationException.class, () -> PersonaRegistry.of(List.of(
                persona("a", 1.5, "x"),
                persona("b", -0.5, "y"))));
    }

    @Test
    @DisplayName("rejects repeated criterion names within a persona")
    void rejectsRepeatedCriteria() {
        var persona = new Persona("a", "A", 1.0,
                List.of(new Criterion("x", "X", "", List.of()), new Criterion("x", "X again", "", List.of())),
                List.of(), "", "", List.of());

        assertThrows(PersonaConfigurationException.class, () -> PersonaRegistry.of(List.of(persona)));
    }

    @Test
    @DisplayName("rejects a persona without criteria")
    void rejectsNoCriteria() {
        assertThrows(PersonaConfigurationException.class,
                () -> PersonaRegistry.of(List.of(persona("a", 1.0))));
    }

    @Test
    @DisplayName("domain taxonomy follows registry order")
    void taxonomyOrder() {
        var registry = PersonaRegistry.of(List.of(
                persona("z", "Z", 0.5, List.of("mentorship"), "x"),
                persona("a", "A", 0.5, List.of("budget"), "y")));

        assertEquals(List.of("z", "a"), List.copyOf(registry.domainTaxonomy().keySet()));
        assertEquals(List.of("budget"), registry.domainTaxonomy().get("a"));
    }

    @Test
    @DisplayName("find returns empty for unknown keys")
    void findUnknown() {
        var registry = PersonaRegistry.of(List.of(persona("a", 1.0, "x")));

        assertTrue(registry.find("b").isEmpty());
        assertTrue(registry.find("a").isPresent());
    }
}
