package com.hirepanel.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hirepanel.evaluation")
public class EvaluationProperties {

    /** Maximum number of persona calls in flight at once. */
    private int concurrency = 4;

    /** Per-call deadline for a single persona. */
    private int timeoutSeconds = 300;

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
