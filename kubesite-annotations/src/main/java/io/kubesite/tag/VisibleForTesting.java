/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.tag;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type, constructor, method or field whose visibility is wider than production
 * code needs, so that tests in the same package can reach it.
 * Production code should not depend on the annotated element.
 */
@Documented
@Target({ ElementType.TYPE,
        ElementType.CONSTRUCTOR,
        ElementType.METHOD,
        ElementType.FIELD })
@Retention(RetentionPolicy.SOURCE)
public @interface VisibleForTesting {
}
