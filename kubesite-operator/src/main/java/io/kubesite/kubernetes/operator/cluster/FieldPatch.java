/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.cluster;

import io.fabric8.kubernetes.api.model.HasMetadata;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A partial update covering exactly the fields the operator owns on a resource.
 * Everything outside {@link #fieldMask()} belongs to other actors and is never sent.
 *
 * @param <T> the kind of resource patched
 */
public interface FieldPatch<T extends HasMetadata> {

    /**
     * @return A description of the field path(s) this patch writes.
     */
    String fieldMask();

    /**
     * @return The {@code resourceVersion} the patch was computed against, or null to skip the optimistic concurrency check.
     */
    @Nullable
    String resourceVersion();

    /**
     * @return This patch as a Kubernetes strategic merge patch document.
     */
    String toStrategicMergePatch();

    /**
     * @return A copy of {@code live} with this patch applied, {@code live} itself is not modified.
     */
    T applyTo(T live);
}
