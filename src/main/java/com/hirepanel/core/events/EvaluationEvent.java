package com.hirepanel.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during an evaluation run, used for CLI progress output.
 *
 * @param eventType  event type (e.g. "run.started", "persona.state", "persona.failed")
 * @param runId      the run this event belongs to
 * @param personaKey the persona this event relates to (nullable for run-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record EvaluationEvent(
    String eventType,
    String runId,
    String personaKey,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String PERSONA_STATE = "persona.state";
    public static final String PERSONA_COMPLETED = "persona.completed";
    public static final String PERSONA_FAILED = "persona.failed";
    public static final String RUN_COMPLETED = "run.completed";

    public static EvaluationEvent of(String eventType, String runId, String personaKey, Map<String, Object> payload) {
        return new EvaluationEvent(eventType, runId, personaKey, payload, Instant.now());
    }
}
