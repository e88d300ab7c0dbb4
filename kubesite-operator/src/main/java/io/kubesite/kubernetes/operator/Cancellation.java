/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.concurrent.CancellationException;

import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;

/**
 * A reconciliation is cancelled by interrupting its worker thread. Checked before every cluster call,
 * the interrupt flag is left set so the worker can see it too.
 */
final class Cancellation {

    private Cancellation() {
    }

    static void throwIfCancelled(ResourceIdentity identity) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Reconciliation of " + identity + " was cancelled");
        }
    }
}
