/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sets the image of one named container in a {@code Deployment}'s pod template.
 * <p>
 * The image is the only field of a {@code Deployment} the operator owns once the
 * {@code Deployment} exists. As a strategic merge patch the containers list is merged
 * by {@code name}, so other containers and every other field of the matched container
 * are left alone.
 *
 * @param containerName name of the container whose image is set
 * @param image the new image reference
 * @param resourceVersion the live resource version the patch was computed against
 */
public record ContainerImagePatch(String containerName, String image, @Nullable String resourceVersion) implements FieldPatch<Deployment> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ContainerImagePatch {
        Objects.requireNonNull(containerName, "containerName");
        Objects.requireNonNull(image, "image");
    }

    /**
     * Compares the owned field of {@code live} against {@code target}.
     * The live container is matched by the target container's name, falling back to the
     * first container of the live pod template.
     *
     * @return the patch converging {@code live}, or empty if the image already matches
     */
    public static Optional<ContainerImagePatch> between(Deployment target, Deployment live) {
        Container desired = containers(target).stream()
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("target Deployment has no container"));
        List<Container> liveContainers = containers(live);
        Container current = liveContainers.stream()
                .filter(c -> desired.getName().equals(c.getName()))
                .findFirst()
                .orElse(liveContainers.isEmpty() ? null : liveContainers.get(0));
        if (current != null && desired.getImage().equals(current.getImage())) {
            return Optional.empty();
        }
        String name = current == null ? desired.getName() : current.getName();
        return Optional.of(new ContainerImagePatch(name, desired.getImage(), live.getMetadata().getResourceVersion()));
    }

    @Nullable
    public static String currentImage(Deployment live, String containerName) {
        return containers(live).stream()
                .filter(c -> containerName.equals(c.getName()))
                .map(Container::getImage)
                .findFirst()
                .orElse(null);
    }

    private static List<Container> containers(Deployment deployment) {
        return Optional.ofNullable(deployment.getSpec())
                .map(DeploymentSpec::getTemplate)
                .map(PodTemplateSpec::getSpec)
                .map(PodSpec::getContainers)
                .orElse(List.of());
    }

    @Override
    public String fieldMask() {
        return "spec.template.spec.containers[name=" + containerName + "].image";
    }

    @Override
    public String toStrategicMergePatch() {
        ObjectNode root = MAPPER.createObjectNode();
        if (resourceVersion != null) {
            root.putObject("metadata").put("resourceVersion", resourceVersion);
        }
        root.putObject("spec")
                .putObject("template")
                .putObject("spec")
                .putArray("containers")
                .addObject()
                .put("name", containerName)
                .put("image", image);
        try {
            return MAPPER.writeValueAsString(root);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize patch for " + fieldMask(), e);
        }
    }

    @Override
    public Deployment applyTo(Deployment live) {
        Deployment patched = new DeploymentBuilder(live).build();
        List<Container> containers = patched.getSpec().getTemplate().getSpec().getContainers();
        Optional<Container> match = containers.stream()
                .filter(c -> containerName.equals(c.getName()))
                .findFirst();
        if (match.isPresent()) {
            match.get().setImage(image);
        }
        else {
            containers.add(new ContainerBuilder().withName(containerName).withImage(image).build());
        }
        return patched;
    }
}
