package com.hirepanel.dispatch.cli;

import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.Persona;
import com.hirepanel.core.persona.PersonaConfigurationException;
import com.hirepanel.core.persona.PersonaLoader;
import com.hirepanel.core.persona.PersonaRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: hirepanel personas
 * <p>
 * Loads and validates the enabled personas, then lists them with weights and criteria.
 */
@Command(name = "personas", mixinStandardHelpOptions = true, description = "List enabled personas")
@Component
public class PersonasCommand implements Callable<Integer> {

    private final PersonaLoader personaLoader;

    public PersonasCommand(PersonaLoader personaLoader) {
        this.personaLoader = personaLoader;
    }

    @Override
    public Integer call() {
        PersonaRegistry registry;
        try {
            registry = personaLoader.load();
        } catch (PersonaConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println("PERSONAS (" + registry.size() + "):");
        for (Persona persona : registry.personas()) {
            System.out.printf(Locale.ROOT, "  %-10s %-26s %3d%%%n",
                    persona.key(), persona.displayName(), Math.round(persona.weight() * 100));
            for (Criterion criterion : persona.criteria()) {
                System.out.println("      - " + criterion.name() + ": " + criterion.title());
            }
        }
        return 0;
    }
}
