/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import io.kubesite.kubernetes.api.v1.Website;
import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;

/**
 * The ownership labels stamped on, and used to select, the resources belonging to a {@code Website}.
 */
public class Labels {

    public static final String WEBSITE_LABEL = "website";
    public static final String TYPE_LABEL = "type";
    public static final String TYPE_VALUE = Website.KIND;

    private Labels() {
        // singleton
    }

    public static Map<String, String> ownershipLabels(String websiteName) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(WEBSITE_LABEL, websiteName);
        labels.put(TYPE_LABEL, TYPE_VALUE);
        return labels;
    }

    public static Map<String, String> typeSelector() {
        return Map.of(TYPE_LABEL, TYPE_VALUE);
    }

    /**
     * @return The identity of the {@code Website} owning the given resource, judged only by its labels.
     */
    public static Optional<ResourceIdentity> owner(HasMetadata resource) {
        ObjectMeta metadata = resource.getMetadata();
        if (metadata == null || metadata.getLabels() == null || metadata.getNamespace() == null) {
            return Optional.empty();
        }
        Map<String, String> labels = metadata.getLabels();
        String websiteName = labels.get(WEBSITE_LABEL);
        if (!TYPE_VALUE.equals(labels.get(TYPE_LABEL)) || websiteName == null || websiteName.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResourceIdentity(metadata.getNamespace(), websiteName));
    }
}
