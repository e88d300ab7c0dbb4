/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

/**
 * A problem with the operator's own configuration, which prevents it from starting.
 * Such problems exist independently of any particular {@code Website}.
 */
public class OperatorConfigurationException extends RuntimeException {

    public OperatorConfigurationException(String msg) {
        super(msg);
    }

    public OperatorConfigurationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
