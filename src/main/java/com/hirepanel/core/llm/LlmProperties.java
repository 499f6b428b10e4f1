package com.hirepanel.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "hirepanel.llm")
public class LlmProperties {

    private String model = "dolphin3:latest";
    private String fastModel = "phi3:mini";
    private Map<String, Double> temperatures = new LinkedHashMap<>(Map.of(
            "dolphin3:latest", 0.7,
            "phi3:mini", 0.3));
    private double defaultTemperature = 0.1;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getFastModel() {
        return fastModel;
    }

    public void setFastModel(String fastModel) {
        this.fastModel = fastModel;
    }

    public Map<String, Double> getTemperatures() {
        return temperatures;
    }

    public void setTemperatures(Map<String, Double> temperatures) {
        this.temperatures = temperatures;
    }

    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    public void setDefaultTemperature(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    /**
     * Model for a run: an explicit override wins, then fast mode, then the quality model.
     */
    public String resolveModel(String override, boolean fastMode) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        return fastMode ? fastModel : model;
    }

    public double temperatureFor(String modelName) {
        Double temperature = temperatures.get(modelName);
        return temperature != null ? temperature : defaultTemperature;
    }
}
