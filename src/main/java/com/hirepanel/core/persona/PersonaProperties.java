package com.hirepanel.core.persona;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "hirepanel.personas")
public class PersonaProperties {

    /** Directory holding one {@code <key>.yaml} file per persona. */
    private String location = "classpath:personas/";

    /** Enabled persona keys; this order is the enumeration order used everywhere. */
    private List<String> enabled = new ArrayList<>(List.of("hr", "technical", "design", "finance", "ceo", "team"));

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getEnabled() {
        return enabled;
    }

    public void setEnabled(List<String> enabled) {
        this.enabled = enabled;
    }
}
