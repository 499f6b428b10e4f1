package com.hirepanel.core.metrics;

import com.hirepanel.core.model.ErrorKind;
import com.hirepanel.core.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for evaluation runs.
 */
@Service
public class EvaluationMetrics {

    private final MeterRegistry registry;

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall-clock time of one persona evaluation.
     *
     * @param persona persona key
     * @param outcome "success" or the lower-cased error kind
     */
    public void recordPersonaDuration(String persona, String outcome, long ms) {
        Timer.builder("hirepanel.persona.duration")
                .description("Persona evaluation duration, prompt to validated result")
                .tag("persona", persona)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPersonaFailure(ErrorKind kind) {
        Counter.builder("hirepanel.persona.failures")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public void recordRunResult(RunStatus status) {
        Counter.builder("hirepanel.runs.total")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordCompositeScore(double score) {
        DistributionSummary.builder("hirepanel.composite.score")
                .description("Weighted composite score per completed run")
                .register(registry)
                .record(score);
    }
}
