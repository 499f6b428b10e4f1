package com.hirepanel.core.model;

import java.util.List;

/**
 * Overall status of an evaluation run, derived from its outcomes.
 */
public enum RunStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILURE;

    public static RunStatus of(List<? extends EvaluationOutcome> outcomes) {
        long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
        if (failed == 0 && !outcomes.isEmpty()) {
            return SUCCESS;
        }
        return failed == outcomes.size() ? FAILURE : PARTIAL_SUCCESS;
    }
}
