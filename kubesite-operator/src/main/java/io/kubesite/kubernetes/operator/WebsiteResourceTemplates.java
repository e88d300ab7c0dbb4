/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;

import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

import static io.kubesite.kubernetes.operator.Labels.ownershipLabels;

/**
 * Maps a {@code Website} to the {@code Deployment} and {@code Service} it needs.
 * <p>
 * This is the only place the operator's policies live: two replicas, a single
 * container serving on port 80 and a NodePort Service exposing it on node port 31000.
 * Methods are pure: equal inputs give equal outputs, which is what allows a live
 * resource to be compared with its template.
 */
public class WebsiteResourceTemplates {

    public static final String DEFAULT_IMAGE_REPOSITORY = "abangser/todo-local-storage";
    public static final String CONTAINER_NAME = "nginx";
    public static final int REPLICAS = 2;
    public static final int CONTAINER_PORT = 80;
    public static final int SERVICE_PORT = 80;
    public static final int NODE_PORT = 31000;
    static final String SERVICE_TYPE = "NodePort";

    private final String imageRepository;

    public WebsiteResourceTemplates() {
        this(DEFAULT_IMAGE_REPOSITORY);
    }

    public WebsiteResourceTemplates(String imageRepository) {
        this.imageRepository = Objects.requireNonNull(imageRepository);
    }

    /**
     * @return The container image reference for the given tag. An empty tag gives a reference ending in {@code :},
     * which the API server will reject.
     */
    public String image(String imageTag) {
        return imageRepository + ":" + imageTag;
    }

    public ManagedResourceSpec<Deployment> buildDeploymentSpec(ResourceIdentity identity, String imageTag) {
        // @formatter:off
        Deployment deployment = new DeploymentBuilder()
                .withNewMetadata()
                    .withName(identity.name())
                    .withNamespace(identity.namespace())
                    .withLabels(ownershipLabels(identity.name()))
                .endMetadata()
                .withNewSpec()
                    .withReplicas(REPLICAS)
                    .withNewSelector()
                        .withMatchLabels(ownershipLabels(identity.name()))
                    .endSelector()
                    .withNewTemplate()
                        .withNewMetadata()
                            .withLabels(ownershipLabels(identity.name()))
                        .endMetadata()
                        .withNewSpec()
                            .addNewContainer()
                                .withName(CONTAINER_NAME)
                                .withImage(image(imageTag))
                                .addNewPort()
                                    .withContainerPort(CONTAINER_PORT)
                                .endPort()
                            .endContainer()
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .build();
        // @formatter:on
        return new ManagedResourceSpec<>(ResourceKind.DEPLOYMENT, deployment);
    }

    public ManagedResourceSpec<Service> buildServiceSpec(ResourceIdentity identity) {
        // @formatter:off
        Service service = new ServiceBuilder()
                .withNewMetadata()
                    .withName(identity.name())
                    .withNamespace(identity.namespace())
                    .withLabels(ownershipLabels(identity.name()))
                .endMetadata()
                .withNewSpec()
                    .withType(SERVICE_TYPE)
                    .withSelector(ownershipLabels(identity.name()))
                    .addNewPort()
                        .withPort(SERVICE_PORT)
                        .withNodePort(NODE_PORT)
                    .endPort()
                .endSpec()
                .build();
        // @formatter:on
        return new ManagedResourceSpec<>(ResourceKind.SERVICE, service);
    }

    /**
     * @return Every resource the {@code Website} needs, in the order they should be converged.
     */
    public List<ManagedResourceSpec<?>> buildTargets(ResourceIdentity identity, String imageTag) {
        return List.of(buildDeploymentSpec(identity, imageTag), buildServiceSpec(identity));
    }
}
