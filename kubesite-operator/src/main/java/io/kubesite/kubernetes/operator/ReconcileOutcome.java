/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.Objects;

/**
 * The result of one reconciliation of a {@code Website}, deciding whether it is run again.
 */
public sealed interface ReconcileOutcome permits ReconcileOutcome.Converged, ReconcileOutcome.Retryable, ReconcileOutcome.Fatal {

    /**
     * Every managed resource matches its template, nothing more to do.
     */
    record Converged() implements ReconcileOutcome {}

    /**
     * A transient problem, the reconciliation should be repeated after a backoff.
     *
     * @param reason why
     */
    record Retryable(String reason) implements ReconcileOutcome {
        public Retryable {
            Objects.requireNonNull(reason);
        }
    }

    /**
     * A problem that needs a human to fix it, retrying would fail the same way.
     *
     * @param reason why
     */
    record Fatal(String reason) implements ReconcileOutcome {
        public Fatal {
            Objects.requireNonNull(reason);
        }
    }

    static ReconcileOutcome converged() {
        return new Converged();
    }

    static ReconcileOutcome retryable(String reason) {
        return new Retryable(reason);
    }

    static ReconcileOutcome fatal(String reason) {
        return new Fatal(reason);
    }
}
