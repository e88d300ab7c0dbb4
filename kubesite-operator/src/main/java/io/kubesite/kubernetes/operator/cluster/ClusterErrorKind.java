/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Why a call to the Kubernetes API failed.
 */
public enum ClusterErrorKind {
    /** The resource does not exist. */
    NOT_FOUND(false),
    /** A resource with the same identity already exists. */
    ALREADY_EXISTS(false),
    /** A concurrent modification, typically a stale {@code resourceVersion}. */
    CONFLICT(true),
    /** The request was rejected on schema, quota or permission grounds. */
    INVALID(false),
    /** A Service's requested node port is held by some Service. */
    PORT_ALLOCATED(false),
    /** The API server could not be reached or asked us to back off. */
    UNAVAILABLE(true),
    OTHER(false);

    static final String PORT_ALLOCATED_MESSAGE = "provided port is already allocated";
    private static final String ALREADY_EXISTS_REASON = "AlreadyExists";
    private static final Set<Integer> INVALID_CODES = Set.of(400, 401, 403, 405, 413, 415, 422);

    private final boolean transientFailure;

    ClusterErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * @return true if repeating the same request later may succeed without anyone changing the inputs.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Classifies a failure reported by the fabric8 client using the HTTP status code,
     * the {@code Status} reason and, only for node port collisions, the message text.
     */
    public static ClusterErrorKind classify(KubernetesClientException e) {
        int code = e.getCode();
        String reason = Optional.ofNullable(e.getStatus()).map(Status::getReason).orElse("");
        String message = messageOf(e);
        if (code == 404) {
            return NOT_FOUND;
        }
        else if (code == 409) {
            return ALREADY_EXISTS_REASON.equals(reason) || message.contains("already exists") ? ALREADY_EXISTS : CONFLICT;
        }
        else if ((code == 422 || code == 400) && message.contains(PORT_ALLOCATED_MESSAGE)) {
            return PORT_ALLOCATED;
        }
        else if (INVALID_CODES.contains(code)) {
            return INVALID;
        }
        else if (code == 429 || code >= 500 || code <= 0) {
            return UNAVAILABLE;
        }
        return OTHER;
    }

    private static String messageOf(KubernetesClientException e) {
        String statusMessage = Optional.ofNullable(e.getStatus()).map(Status::getMessage).orElse("");
        String exceptionMessage = Optional.ofNullable(e.getMessage()).orElse("");
        return statusMessage + " " + exceptionMessage;
    }
}
