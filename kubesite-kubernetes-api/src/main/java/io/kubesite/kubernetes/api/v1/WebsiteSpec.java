/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.api.v1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import io.fabric8.generator.annotation.Pattern;
import io.fabric8.generator.annotation.Required;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebsiteSpec {

    public static final String IMAGE_TAG_PATTERN = "^[-a-z0-9]*$";

    @Required
    @Pattern(IMAGE_TAG_PATTERN)
    @JsonPropertyDescription("The tag of the website's container image.")
    private String imageTag;

    public WebsiteSpec() {
    }

    public WebsiteSpec(String imageTag) {
        this.imageTag = imageTag;
    }

    public String getImageTag() {
        return imageTag;
    }

    public void setImageTag(String imageTag) {
        this.imageTag = imageTag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WebsiteSpec that = (WebsiteSpec) o;
        return Objects.equals(imageTag, that.imageTag);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(imageTag);
    }

    @Override
    public String toString() {
        return "WebsiteSpec[imageTag=" + imageTag + "]";
    }
}
