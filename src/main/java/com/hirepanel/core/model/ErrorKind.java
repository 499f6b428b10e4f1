package com.hirepanel.core.model;

/**
 * Failure taxonomy for persona evaluations and runs.
 */
public enum ErrorKind {
    /** Network or connection failure; the caller may retry the whole persona. */
    BACKEND_UNREACHABLE,
    /** The call exceeded its deadline. */
    TIMEOUT,
    /** The backend returned output that is not parseable JSON. */
    MALFORMED_JSON,
    /** Parseable JSON that lacks required criterion fields or violates bounds. */
    SCHEMA_VIOLATION,
    /** Persona configuration is unusable; aborts the run before any call. */
    CONFIGURATION_ERROR,
    /** Run-level cancellation reached this persona. */
    CANCELLED,
    /** Unexpected failure while preparing the prompt or mapping the response. */
    INTERNAL_ERROR
}
