/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * The namespace and name of a namespaced Kubernetes resource.
 * A {@code Website} and every resource it owns share the same identity.
 *
 * @param namespace the namespace
 * @param name the name
 */
public record ResourceIdentity(String namespace, String name) {

    public ResourceIdentity {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static ResourceIdentity of(HasMetadata resource) {
        return new ResourceIdentity(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
