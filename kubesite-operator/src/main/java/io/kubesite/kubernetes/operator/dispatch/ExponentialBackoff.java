/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay before retry number {@code n}: {@code initial * 2^(n-1)}, capped at {@code max}.
 *
 * @param initial delay before the first retry
 * @param max upper bound on any delay
 */
public record ExponentialBackoff(Duration initial, Duration max) {

    private static final int MAX_DOUBLINGS = 30;

    public ExponentialBackoff {
        Objects.requireNonNull(initial);
        Objects.requireNonNull(max);
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be positive, was " + initial);
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff " + max + " is less than initial backoff " + initial);
        }
    }

    /**
     * @param attempt the 1-based count of consecutive failures
     */
    public Duration delay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1, was " + attempt);
        }
        Duration delay = initial.multipliedBy(1L << Math.min(attempt - 1, MAX_DOUBLINGS));
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
