/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * The calls the reconciler makes against the cluster.
 * Every call is synchronous and reads or writes the API server directly: nothing is cached.
 * Implementations must be safe to share between worker threads.
 * Failures are thrown as {@link ClusterOperationException} carrying a {@link ClusterErrorKind}.
 */
public interface ClusterClient {

    /**
     * @return the live resource, or empty if it does not exist
     * @throws ClusterOperationException if the read failed for any other reason
     */
    <T extends HasMetadata> Optional<T> get(ResourceIdentity identity, ResourceKind<T> kind);

    /**
     * Creates the given resource exactly as specified.
     *
     * @throws ClusterOperationException with {@link ClusterErrorKind#ALREADY_EXISTS} if a resource with the same identity exists
     */
    void create(HasMetadata resource);

    /**
     * Applies a partial update, touching only the fields covered by the patch.
     *
     * @throws ClusterOperationException with {@link ClusterErrorKind#CONFLICT} if the patch's resource version is stale
     */
    <T extends HasMetadata> void patch(ResourceIdentity identity, ResourceKind<T> kind, FieldPatch<T> patch);
}
