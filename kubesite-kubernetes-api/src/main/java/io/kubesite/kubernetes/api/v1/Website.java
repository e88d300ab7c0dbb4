/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.api.v1;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A user's declaration that a website should be running in its namespace.
 * <p>
 * The operator has no status to report, so the status type is {@link Void}.
 */
@Group(Website.GROUP)
@Version(Website.VERSION)
@Kind(Website.KIND)
@Plural(Website.PLURAL)
@Singular("website")
public class Website extends CustomResource<WebsiteSpec, Void> implements Namespaced {

    public static final String GROUP = "dev.mvasilenko.me";
    public static final String VERSION = "v1";
    public static final String KIND = "Website";
    public static final String PLURAL = "websites";

    /**
     * Classpath location of the CustomResourceDefinition for this type.
     */
    public static final String CRD_RESOURCE = "META-INF/kubesite/" + PLURAL + "." + GROUP + "-" + VERSION + ".yml";

    @Override
    protected WebsiteSpec initSpec() {
        return new WebsiteSpec();
    }
}
