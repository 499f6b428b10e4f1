package com.hirepanel.core.service;

import com.hirepanel.core.engine.CancellationToken;

/**
 * Per-run overrides on top of the configured defaults. Null fields keep the default.
 */
public record EvaluationSettings(
    String modelOverride,
    boolean fastMode,
    Integer concurrency,
    Integer timeoutSeconds,
    CancellationToken cancellationToken
) {

    public EvaluationSettings {
        if (cancellationToken == null) {
            cancellationToken = new CancellationToken();
        }
    }

    public static EvaluationSettings defaults() {
        return new EvaluationSettings(null, false, null, null, new CancellationToken());
    }
}
