/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;

/**
 * {@link ClusterClient} backed by a shared fabric8 {@link KubernetesClient}.
 */
public class Fabric8ClusterClient implements ClusterClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(Fabric8ClusterClient.class);
    private static final PatchContext STRATEGIC_MERGE = PatchContext.of(PatchType.STRATEGIC_MERGE);

    private final KubernetesClient client;

    public Fabric8ClusterClient(KubernetesClient client) {
        this.client = Objects.requireNonNull(client);
    }

    @Override
    public <T extends HasMetadata> Optional<T> get(ResourceIdentity identity, ResourceKind<T> kind) {
        try {
            return Optional.ofNullable(client.resources(kind.type())
                    .inNamespace(identity.namespace())
                    .withName(identity.name())
                    .get());
        }
        catch (KubernetesClientException e) {
            throw classified("get", kind, identity, e);
        }
    }

    @Override
    public void create(HasMetadata resource) {
        ResourceKind<?> kind = ResourceKind.of(resource);
        try {
            client.resource(resource).create();
        }
        catch (KubernetesClientException e) {
            throw classified("create", kind, ResourceIdentity.of(resource), e);
        }
    }

    @Override
    public <T extends HasMetadata> void patch(ResourceIdentity identity, ResourceKind<T> kind, FieldPatch<T> patch) {
        LOGGER.debug("Patching {} {} at {}", kind, identity, patch.fieldMask());
        try {
            client.resources(kind.type())
                    .inNamespace(identity.namespace())
                    .withName(identity.name())
                    .patch(STRATEGIC_MERGE, patch.toStrategicMergePatch());
        }
        catch (KubernetesClientException e) {
            throw classified("patch", kind, identity, e);
        }
    }

    private static ClusterOperationException classified(String operation, ResourceKind<?> kind, ResourceIdentity identity, KubernetesClientException e) {
        ClusterErrorKind errorKind = ClusterErrorKind.classify(e);
        LOGGER.atDebug()
                .setMessage("{} of {} {} failed with HTTP {} classified as {}")
                .addArgument(operation)
                .addArgument(kind)
                .addArgument(identity)
                .addArgument(e.getCode())
                .addArgument(errorKind)
                .log();
        return new ClusterOperationException(errorKind,
                "Failed to " + operation + " " + kind + " " + identity + ": " + e.getMessage(),
                e);
    }
}
