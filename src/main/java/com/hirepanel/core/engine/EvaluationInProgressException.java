package com.hirepanel.core.engine;

/**
 * Thrown when a run is requested for a candidate that already has one in flight.
 */
public class EvaluationInProgressException extends RuntimeException {

    private final String candidateKey;

    public EvaluationInProgressException(String candidateKey) {
        super("An evaluation is already running for candidate '" + candidateKey + "'");
        this.candidateKey = candidateKey;
    }

    public String candidateKey() {
        return candidateKey;
    }
}
