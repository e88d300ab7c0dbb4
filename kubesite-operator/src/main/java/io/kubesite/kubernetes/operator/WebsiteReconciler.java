/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubesite.kubernetes.api.v1.Website;
import io.kubesite.kubernetes.api.v1.WebsiteSpec;
import io.kubesite.kubernetes.operator.cluster.ClusterClient;
import io.kubesite.kubernetes.operator.cluster.ClusterOperationException;
import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;
import io.kubesite.kubernetes.operator.cluster.ResourceKind;

/**
 * Reconciles a {@code Website}: reads it, derives the resources it needs and converges each of them in turn.
 * <p>
 * A deleted {@code Website} is reported as converged and its resources are left in place.
 * A fatal result for one resource ends the pass without touching the resources after it.
 * Retryable results do not, so a single pass converges as much as it can.
 * Nothing is rolled back.
 */
public class WebsiteReconciler implements Reconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebsiteReconciler.class);

    private final ClusterClient client;
    private final WebsiteResourceTemplates templates;
    private final ConvergenceEngine convergenceEngine;

    public WebsiteReconciler(ClusterClient client, WebsiteResourceTemplates templates) {
        this.client = Objects.requireNonNull(client);
        this.templates = Objects.requireNonNull(templates);
        this.convergenceEngine = new ConvergenceEngine(client);
    }

    @Override
    public ReconcileOutcome reconcile(ResourceIdentity identity) {
        Cancellation.throwIfCancelled(identity);
        Optional<Website> website;
        try {
            website = client.get(identity, ResourceKind.WEBSITE);
        }
        catch (ClusterOperationException e) {
            String reason = "Failed to read Website " + identity + " (" + e.errorKind() + "): " + e.getMessage();
            return e.errorKind().isTransient() ? ReconcileOutcome.retryable(reason) : ReconcileOutcome.fatal(reason);
        }
        if (website.isEmpty()) {
            // deleting the Deployment and Service is not this operator's job
            LOGGER.info("Website {} does not exist, nothing to reconcile", identity);
            return ReconcileOutcome.converged();
        }

        String imageTag = imageTag(website.get());
        LOGGER.info("Reconciling Website {} with image tag \"{}\"", identity, imageTag);

        List<String> retryReasons = new ArrayList<>();
        for (ManagedResourceSpec<?> target : templates.buildTargets(identity, imageTag)) {
            ConvergenceResult result = convergenceEngine.ensure(target);
            if (result.isFatal()) {
                LOGGER.info("Completed reconciliation of {} with error {}", identity, result.describe());
                return ReconcileOutcome.fatal(result.describe());
            }
            else if (result.isRetryable()) {
                retryReasons.add(result.describe());
            }
            else {
                LOGGER.debug("{}", result.describe());
            }
        }
        if (!retryReasons.isEmpty()) {
            return ReconcileOutcome.retryable(String.join("; ", retryReasons));
        }
        LOGGER.info("Completed reconciliation of {}", identity);
        return ReconcileOutcome.converged();
    }

    private static String imageTag(Website website) {
        return Optional.ofNullable(website.getSpec())
                .map(WebsiteSpec::getImageTag)
                .orElse("");
    }
}
