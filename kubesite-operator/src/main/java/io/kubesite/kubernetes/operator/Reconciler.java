/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;

/**
 * Performs one level-triggered reconciliation of the object with the given identity.
 * Implementations must be idempotent: the same identity can be reconciled any number of times.
 */
@FunctionalInterface
public interface Reconciler {

    /**
     * @throws java.util.concurrent.CancellationException if the calling thread was interrupted
     */
    ReconcileOutcome reconcile(ResourceIdentity identity);
}
