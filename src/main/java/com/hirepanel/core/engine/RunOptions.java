package com.hirepanel.core.engine;

import java.time.Duration;

/**
 * Dispatch policy for one run. Model and temperature travel on each request.
 */
public record RunOptions(
    int concurrency,
    Duration timeout,
    CancellationToken cancellationToken
) {

    public RunOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (cancellationToken == null) {
            cancellationToken = new CancellationToken();
        }
    }

}
