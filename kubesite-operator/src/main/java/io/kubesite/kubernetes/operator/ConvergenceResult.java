/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

/**
 * What happened when converging one managed resource.
 *
 * @param kind kind of the resource
 * @param identity identity of the resource
 * @param action what was done, or why nothing could be done
 * @param detail human readable explanation, empty when there is nothing to add
 */
public record ConvergenceResult(ResourceKind<?> kind, ResourceIdentity identity, Action action, String detail) {

    public enum Action {
        CREATED(true),
        PATCHED(true),
        UP_TO_DATE(true),
        /** The resource exists but the operator does not correct it. */
        DRIFT_ACCEPTED(true),
        RETRYABLE(false),
        FATAL(false);

        private final boolean converged;

        Action(boolean converged) {
            this.converged = converged;
        }

        public boolean isConverged() {
            return converged;
        }
    }

    static ConvergenceResult of(ManagedResourceSpec<?> target, Action action, String detail) {
        return new ConvergenceResult(target.kind(), target.identity(), action, detail);
    }

    public boolean isConverged() {
        return action.isConverged();
    }

    public boolean isRetryable() {
        return action == Action.RETRYABLE;
    }

    public boolean isFatal() {
        return action == Action.FATAL;
    }

    public String describe() {
        String summary = kind + " " + identity + " " + action;
        return detail.isEmpty() ? summary : summary + ": " + detail;
    }
}
