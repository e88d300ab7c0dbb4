/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.apps.Deployment;

import io.kubesite.kubernetes.operator.ConvergenceResult.Action;
import io.kubesite.kubernetes.operator.cluster.ClusterClient;
import io.kubesite.kubernetes.operator.cluster.ClusterErrorKind;
import io.kubesite.kubernetes.operator.cluster.ClusterOperationException;
import io.kubesite.kubernetes.operator.cluster.ContainerImagePatch;
import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

/**
 * Brings one live resource to its template, creating it when absent.
 * <p>
 * Creation is always attempted first. When the resource already exists the operator only
 * corrects what it owns: the container image of a {@code Deployment}. An existing
 * {@code Service}, or one whose node port is already allocated, is accepted as it is.
 * Every failure is turned into a {@link ConvergenceResult} here, callers never see
 * {@link ClusterOperationException}.
 */
public class ConvergenceEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConvergenceEngine.class);

    private final ClusterClient client;

    public ConvergenceEngine(ClusterClient client) {
        this.client = Objects.requireNonNull(client);
    }

    public <T extends HasMetadata> ConvergenceResult ensure(ManagedResourceSpec<T> target) {
        ResourceIdentity identity = target.identity();
        Cancellation.throwIfCancelled(identity);
        try {
            client.create(target.resource());
            LOGGER.info("Created {} {}", target.kind(), identity);
            return ConvergenceResult.of(target, Action.CREATED, "");
        }
        catch (ClusterOperationException e) {
            ClusterErrorKind errorKind = e.errorKind();
            if (errorKind == ClusterErrorKind.ALREADY_EXISTS) {
                LOGGER.debug("{} {} already exists", target.kind(), identity);
                return convergeExisting(target);
            }
            else if (errorKind == ClusterErrorKind.PORT_ALLOCATED && ResourceKind.SERVICE.equals(target.kind())) {
                LOGGER.info("Node port of Service {} is already allocated, accepting the existing Service", identity);
                return ConvergenceResult.of(target, Action.DRIFT_ACCEPTED, "node port already allocated");
            }
            return failed(target, "create", e);
        }
    }

    private <T extends HasMetadata> ConvergenceResult convergeExisting(ManagedResourceSpec<T> target) {
        ResourceIdentity identity = target.identity();
        Cancellation.throwIfCancelled(identity);
        Optional<T> live;
        try {
            live = client.get(identity, target.kind());
        }
        catch (ClusterOperationException e) {
            return failed(target, "get", e);
        }
        if (live.isEmpty()) {
            return ConvergenceResult.of(target, Action.RETRYABLE, "deleted after creation reported it exists");
        }
        if (ResourceKind.DEPLOYMENT.equals(target.kind())) {
            return convergeImage(target,
                    ResourceKind.DEPLOYMENT.cast(target.resource()),
                    ResourceKind.DEPLOYMENT.cast(live.get()));
        }
        return ConvergenceResult.of(target, Action.DRIFT_ACCEPTED, "already exists");
    }

    private ConvergenceResult convergeImage(ManagedResourceSpec<?> target, Deployment desired, Deployment live) {
        ResourceIdentity identity = target.identity();
        Optional<ContainerImagePatch> patch = ContainerImagePatch.between(desired, live);
        if (patch.isEmpty()) {
            return ConvergenceResult.of(target, Action.UP_TO_DATE, "");
        }
        ContainerImagePatch imagePatch = patch.get();
        Cancellation.throwIfCancelled(identity);
        LOGGER.info("Image of Deployment {} has changed from \"{}\" to \"{}\"",
                identity,
                ContainerImagePatch.currentImage(live, imagePatch.containerName()),
                imagePatch.image());
        try {
            client.patch(identity, ResourceKind.DEPLOYMENT, imagePatch);
            return ConvergenceResult.of(target, Action.PATCHED, imagePatch.fieldMask());
        }
        catch (ClusterOperationException e) {
            LOGGER.debug("Patching {} of Deployment {} failed", imagePatch.fieldMask(), identity, e);
            return ConvergenceResult.of(target, Action.RETRYABLE, "patch failed (" + e.errorKind() + "): " + e.getMessage());
        }
    }

    private static ConvergenceResult failed(ManagedResourceSpec<?> target, String operation, ClusterOperationException e) {
        Action action = e.errorKind().isTransient() ? Action.RETRYABLE : Action.FATAL;
        return ConvergenceResult.of(target, action, operation + " failed (" + e.errorKind() + "): " + e.getMessage());
    }
}
