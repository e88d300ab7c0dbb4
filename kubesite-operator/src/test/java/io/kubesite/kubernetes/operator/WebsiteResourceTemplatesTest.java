/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.utils.Serialization;

import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

import static org.assertj.core.api.Assertions.assertThat;

class WebsiteResourceTemplatesTest {

    private static final ResourceIdentity BLOG = new ResourceIdentity("default", "blog");

    private final WebsiteResourceTemplates templates = new WebsiteResourceTemplates();

    @ParameterizedTest
    @CsvSource({ "default,blog,v2", "prod,shop,''", "ns-1,a,latest" })
    void shouldBuildIdenticalTargetsForIdenticalInputs(String namespace, String name, String imageTag) {
        // Given
        ResourceIdentity identity = new ResourceIdentity(namespace, name);

        // When
        List<ManagedResourceSpec<?>> first = templates.buildTargets(identity, imageTag);
        List<ManagedResourceSpec<?>> second = new WebsiteResourceTemplates().buildTargets(identity, imageTag);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(Serialization.asYaml(first.get(0).resource())).isEqualTo(Serialization.asYaml(second.get(0).resource()));
        assertThat(Serialization.asYaml(first.get(1).resource())).isEqualTo(Serialization.asYaml(second.get(1).resource()));
    }

    @Test
    void shouldBuildDeployment() {
        // When
        ManagedResourceSpec<Deployment> spec = templates.buildDeploymentSpec(BLOG, "v2");

        // Then
        Deployment deployment = spec.resource();
        assertThat(spec.kind()).isSameAs(ResourceKind.DEPLOYMENT);
        assertThat(spec.identity()).isEqualTo(BLOG);
        assertThat(spec.labels()).containsOnly(Map.entry("website", "blog"), Map.entry("type", "Website"));
        assertThat(deployment.getSpec().getReplicas()).isEqualTo(2);
        assertThat(deployment.getSpec().getSelector().getMatchLabels()).isEqualTo(spec.labels());
        assertThat(deployment.getSpec().getTemplate().getMetadata().getLabels()).isEqualTo(spec.labels());
        Container container = deployment.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getName()).isEqualTo("nginx");
        assertThat(container.getImage()).isEqualTo("abangser/todo-local-storage:v2");
        assertThat(container.getPorts()).singleElement().satisfies(p -> assertThat(p.getContainerPort()).isEqualTo(80));
    }

    @Test
    void shouldBuildNodePortService() {
        // When
        ManagedResourceSpec<Service> spec = templates.buildServiceSpec(BLOG);

        // Then
        Service service = spec.resource();
        assertThat(spec.kind()).isSameAs(ResourceKind.SERVICE);
        assertThat(service.getMetadata().getNamespace()).isEqualTo("default");
        assertThat(service.getSpec().getType()).isEqualTo("NodePort");
        assertThat(service.getSpec().getSelector()).isEqualTo(Labels.ownershipLabels("blog"));
        assertThat(service.getSpec().getPorts()).singleElement().satisfies(p -> {
            assertThat(p.getPort()).isEqualTo(80);
            assertThat(p.getNodePort()).isEqualTo(31000);
        });
    }

    @Test
    void shouldOrderDeploymentBeforeService() {
        // When
        List<ManagedResourceSpec<?>> targets = templates.buildTargets(BLOG, "v2");

        // Then
        assertThat(targets).hasSize(2);
        assertThat(targets.get(0).kind()).isSameAs(ResourceKind.DEPLOYMENT);
        assertThat(targets.get(1).kind()).isSameAs(ResourceKind.SERVICE);
    }

    @Test
    void shouldUseConfiguredImageRepository() {
        // Given
        WebsiteResourceTemplates custom = new WebsiteResourceTemplates("registry.example/site");

        // When
        String image = custom.image("1.2.3");

        // Then
        assertThat(image).isEqualTo("registry.example/site:1.2.3");
    }

    @Test
    void shouldLeaveTrailingColonForEmptyTag() {
        assertThat(templates.image("")).isEqualTo("abangser/todo-local-storage:");
    }
}
