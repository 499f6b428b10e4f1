package com.hirepanel.core.scoring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hirepanel.scoring")
public class ScoringProperties {

    /**
     * When true, the composite divides by the weight sum of the personas that succeeded,
     * so missing personas do not pull the score down. Off by default.
     */
    private boolean renormalizeMissingWeights = false;

    public boolean isRenormalizeMissingWeights() {
        return renormalizeMissingWeights;
    }

    public void setRenormalizeMissingWeights(boolean renormalizeMissingWeights) {
        this.renormalizeMissingWeights = renormalizeMissingWeights;
    }
}
