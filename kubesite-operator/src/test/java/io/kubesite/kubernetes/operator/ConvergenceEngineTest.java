/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;

import io.kubesite.kubernetes.operator.ConvergenceResult.Action;
import io.kubesite.kubernetes.operator.InMemoryClusterClient.Operation;
import io.kubesite.kubernetes.operator.cluster.ClusterErrorKind;
import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

import static org.assertj.core.api.Assertions.assertThat;

class ConvergenceEngineTest {

    private static final ResourceIdentity SHOP = new ResourceIdentity("retail", "shop");

    private final WebsiteResourceTemplates templates = new WebsiteResourceTemplates("registry.example/site");
    private InMemoryClusterClient cluster;
    private ConvergenceEngine engine;

    @BeforeEach
    void setUp() {
        cluster = new InMemoryClusterClient();
        engine = new ConvergenceEngine(cluster);
    }

    @Test
    void shouldCreateAbsentResource() {
        // Given
        ManagedResourceSpec<Deployment> target = templates.buildDeploymentSpec(SHOP, "1.0");

        // When
        ConvergenceResult result = engine.ensure(target);

        // Then
        assertThat(result.action()).isEqualTo(Action.CREATED);
        assertThat(result.isConverged()).isTrue();
        assertThat(cluster.created()).containsExactly(target.resource());
    }

    @Test
    void shouldReportUpToDateDeployment() {
        // Given
        cluster.seed(templates.buildDeploymentSpec(SHOP, "1.0").resource());

        // When
        ConvergenceResult result = engine.ensure(templates.buildDeploymentSpec(SHOP, "1.0"));

        // Then
        assertThat(result.action()).isEqualTo(Action.UP_TO_DATE);
        assertThat(cluster.mutations()).isZero();
    }

    @Test
    void shouldPatchDeploymentWithDifferentImage() {
        // Given
        cluster.seed(templates.buildDeploymentSpec(SHOP, "1.0").resource());

        // When
        ConvergenceResult result = engine.ensure(templates.buildDeploymentSpec(SHOP, "1.1"));

        // Then
        assertThat(result.action()).isEqualTo(Action.PATCHED);
        assertThat(result.detail()).isEqualTo("spec.template.spec.containers[name=nginx].image");
        assertThat(cluster.patches()).hasSize(1);
    }

    @Test
    void shouldAcceptExistingServiceAsItIs() {
        // Given
        Service drifted = new ServiceBuilder(templates.buildServiceSpec(SHOP).resource())
                .editSpec()
                    .editFirstPort()
                        .withNodePort(null)
                        .withPort(8080)
                    .endPort()
                .endSpec()
                .build();
        cluster.seed(drifted);

        // When
        ConvergenceResult result = engine.ensure(templates.buildServiceSpec(SHOP));

        // Then
        assertThat(result.action()).isEqualTo(Action.DRIFT_ACCEPTED);
        assertThat(cluster.mutations()).isZero();
        assertThat(cluster.find(ResourceKind.SERVICE, SHOP).orElseThrow().getSpec().getPorts().get(0).getPort()).isEqualTo(8080);
    }

    @Test
    void shouldAcceptServiceWhenNodePortIsAllocated() {
        // Given
        cluster.failOn(Operation.CREATE, ResourceKind.SERVICE, ClusterErrorKind.PORT_ALLOCATED);

        // When
        ConvergenceResult result = engine.ensure(templates.buildServiceSpec(SHOP));

        // Then
        assertThat(result.action()).isEqualTo(Action.DRIFT_ACCEPTED);
        assertThat(result.isConverged()).isTrue();
    }

    @Test
    void shouldTreatPortAllocatedDeploymentAsFatal() {
        // Given
        cluster.failOn(Operation.CREATE, ResourceKind.DEPLOYMENT, ClusterErrorKind.PORT_ALLOCATED);

        // When
        ConvergenceResult result = engine.ensure(templates.buildDeploymentSpec(SHOP, "1.0"));

        // Then
        assertThat(result.action()).isEqualTo(Action.FATAL);
    }

    @Test
    void shouldRetryWhenResourceVanishesAfterAlreadyExists() {
        // Given
        cluster.failOn(Operation.CREATE, ResourceKind.DEPLOYMENT, ClusterErrorKind.ALREADY_EXISTS);

        // When
        ConvergenceResult result = engine.ensure(templates.buildDeploymentSpec(SHOP, "1.0"));

        // Then
        assertThat(result.action()).isEqualTo(Action.RETRYABLE);
    }

    @Test
    void shouldRetryWhenReadOfExistingResourceIsUnavailable() {
        // Given
        cluster.seed(templates.buildDeploymentSpec(SHOP, "1.0").resource());
        cluster.failOn(Operation.GET, ResourceKind.DEPLOYMENT, ClusterErrorKind.UNAVAILABLE);

        // When
        ConvergenceResult result = engine.ensure(templates.buildDeploymentSpec(SHOP, "1.1"));

        // Then
        assertThat(result.action()).isEqualTo(Action.RETRYABLE);
        assertThat(result.describe()).startsWith("Deployment retail/shop RETRYABLE: get failed (UNAVAILABLE)");
    }

    @ParameterizedTest
    @EnumSource(value = ClusterErrorKind.class, names = { "CONFLICT", "UNAVAILABLE" })
    void shouldRetryTransientCreateFailures(ClusterErrorKind errorKind) {
        // Given
        cluster.failOn(Operation.CREATE, ResourceKind.SERVICE, errorKind);

        // When
        ConvergenceResult result = engine.ensure(templates.buildServiceSpec(SHOP));

        // Then
        assertThat(result.isRetryable()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ClusterErrorKind.class, names = { "NOT_FOUND", "INVALID", "OTHER" })
    void shouldFailOnPermanentCreateFailures(ClusterErrorKind errorKind) {
        // Given
        cluster.failOn(Operation.CREATE, ResourceKind.SERVICE, errorKind);

        // When
        ConvergenceResult result = engine.ensure(templates.buildServiceSpec(SHOP));

        // Then
        assertThat(result.isFatal()).isTrue();
        assertThat(result.detail()).contains(errorKind.name());
    }
}
