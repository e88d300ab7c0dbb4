/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;

import io.kubesite.kubernetes.api.v1.Website;

/**
 * The kinds of resource the operator reads or writes, each tied to its fabric8 model class.
 *
 * @param <T> the model class
 */
public final class ResourceKind<T extends HasMetadata> {

    public static final ResourceKind<Website> WEBSITE = new ResourceKind<>(Website.class);
    public static final ResourceKind<Deployment> DEPLOYMENT = new ResourceKind<>(Deployment.class);
    public static final ResourceKind<Service> SERVICE = new ResourceKind<>(Service.class);

    private static final List<ResourceKind<?>> KNOWN = List.of(WEBSITE, DEPLOYMENT, SERVICE);

    private final Class<T> type;

    private ResourceKind(Class<T> type) {
        this.type = type;
    }

    public Class<T> type() {
        return type;
    }

    /**
     * @return The Kubernetes {@code kind}, for example {@code Deployment}.
     */
    public String kind() {
        return HasMetadata.getKind(type);
    }

    public T cast(HasMetadata resource) {
        return type.cast(resource);
    }

    /**
     * @throws IllegalArgumentException if the resource is not of a kind this operator handles
     */
    public static ResourceKind<?> of(HasMetadata resource) {
        return KNOWN.stream()
                .filter(kind -> kind.type.isInstance(resource))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported resource kind " + resource.getKind()));
    }

    @Override
    public String toString() {
        return kind();
    }
}
