/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A failed call to the Kubernetes API, already classified at the point of the call.
 */
public class ClusterOperationException extends RuntimeException {

    private final ClusterErrorKind errorKind;

    public ClusterOperationException(ClusterErrorKind errorKind, String message) {
        this(errorKind, message, null);
    }

    public ClusterOperationException(ClusterErrorKind errorKind, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ClusterErrorKind errorKind() {
        return errorKind;
    }
}
