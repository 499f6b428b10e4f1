package com.hirepanel.core.persona;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.Persona;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads persona definitions from {@code <location>/<key>.yaml} and builds a
 * validated {@link PersonaRegistry}.
 * <p>
 * Files are re-read on every {@link #load()} so edits take effect on the next run.
 */
@Service
public class PersonaLoader {

    private static final Logger log = LoggerFactory.getLogger(PersonaLoader.class);

    private final ResourceLoader resourceLoader;
    private final PersonaProperties properties;
    private final ObjectMapper yamlMapper;

    public PersonaLoader(ResourceLoader resourceLoader, PersonaProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public PersonaRegistry load() {
        var personas = new ArrayList<Persona>();
        for (String key : properties.getEnabled()) {
            personas.add(loadPersona(key.trim()));
        }
        PersonaRegistry registry = PersonaRegistry.of(personas);
        log.info("Loaded {} personas from {}", registry.size(), properties.getLocation());
        return registry;
    }

    Persona loadPersona(String key) {
        String location = properties.getLocation();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        Resource resource = resourceLoader.getResource(location + key + ".yaml");
        if (!resource.exists()) {
            throw new PersonaConfigurationException("Persona file not found: " + location + key + ".yaml");
        }

        JsonNode root;
        try (InputStream is = resource.getInputStream()) {
            root = yamlMapper.readTree(is);
        } catch (IOException e) {
            throw new PersonaConfigurationException("Cannot read persona file for " + key + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PersonaConfigurationException("Persona file for " + key + " is empty or not a mapping");
        }

        String name = requiredText(root, "name", key);
        JsonNode weightNode = root.get("weight");
        if (weightNode == null || !weightNode.isNumber()) {
            throw new PersonaConfigurationException("Persona " + key + " must declare a numeric weight");
        }

        JsonNode criteriaNode = root.get("criteria");
        if (criteriaNode == null || !criteriaNode.isArray() || criteriaNode.isEmpty()) {
            throw new PersonaConfigurationException("Persona " + key + " must declare a non-empty criteria list");
        }
        var criteria = new ArrayList<Criterion>();
        for (JsonNode c : criteriaNode) {
            String criterionName = requiredText(c, "name", key);
            criteria.add(new Criterion(
                    criterionName,
                    c.path("title").asText(criterionName),
                    c.path("description").asText(""),
                    textList(c.get("bullets"))));
        }

        log.debug("Persona {} ({}) declares criteria {}", key, name,
                criteria.stream().map(Criterion::name).toList());
        return new Persona(
                key,
                name,
                weightNode.asDouble(),
                criteria,
                textList(root.get("background")),
                root.path("evaluation_approach").asText("").trim(),
                root.path("focus").asText(""),
                textList(root.get("domain_keywords")));
    }

    private static String requiredText(JsonNode node, String field, String personaKey) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new PersonaConfigurationException("Persona " + personaKey + " is missing '" + field + "'");
        }
        return value.asText();
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        var values = new ArrayList<String>();
        node.forEach(n -> values.add(n.asText()));
        return values;
    }
}
