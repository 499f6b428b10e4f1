package com.hirepanel.core.model;

import java.io.Serializable;

/**
 * Result of one persona evaluation: either a {@link Success} or a {@link Failure}.
 * The orchestrator always returns exactly one outcome per enabled persona.
 */
public sealed interface EvaluationOutcome extends Serializable
        permits EvaluationOutcome.Success, EvaluationOutcome.Failure {

    String personaKey();

    boolean isSuccess();

    record Success(PersonaEvaluation evaluation) implements EvaluationOutcome {
        @Override
        public String personaKey() {
            return evaluation.persona().key();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(String personaKey, ErrorKind errorKind, String detail) implements EvaluationOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
