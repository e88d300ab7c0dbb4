/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.Map;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

/**
 * The exact shape of a resource a {@code Website} needs. Computed afresh on every
 * reconciliation and never stored.
 *
 * @param kind the resource kind
 * @param resource the desired resource
 * @param <T> the model class
 */
public record ManagedResourceSpec<T extends HasMetadata>(ResourceKind<T> kind, T resource) {

    public ManagedResourceSpec {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(resource);
    }

    public ResourceIdentity identity() {
        return ResourceIdentity.of(resource);
    }

    public Map<String, String> labels() {
        return resource.getMetadata().getLabels();
    }
}
