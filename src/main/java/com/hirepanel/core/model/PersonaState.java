package com.hirepanel.core.model;

/**
 * Lifecycle of a single persona evaluation within a run.
 * {@code FAILED} and {@code SUCCESS} are terminal.
 */
public enum PersonaState {
    PENDING,
    PROMPT_BUILT,
    REQUEST_IN_FLIGHT,
    PARSED_OK,
    VALIDATED,
    SUCCESS,
    FAILED
}
