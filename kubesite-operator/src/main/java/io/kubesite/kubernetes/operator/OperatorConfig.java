/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Operator settings, read from environment variables.
 *
 * @param bindHost interface the management server binds to
 * @param bindPort port the management server binds to
 * @param watchNamespace the single namespace to watch, or null for all namespaces
 * @param workers number of reconciliation workers
 * @param initialBackoff delay before the first retry of a failed reconciliation
 * @param maxBackoff upper bound on the retry delay
 * @param resyncPeriod interval at which informers replay their cache
 * @param imageRepository the repository of the website container image
 */
public record OperatorConfig(String bindHost,
                             int bindPort,
                             @Nullable String watchNamespace,
                             int workers,
                             Duration initialBackoff,
                             Duration maxBackoff,
                             Duration resyncPeriod,
                             String imageRepository) {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorConfig.class);

    static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    static final String WATCH_NAMESPACE_VAR_NAME = "WATCH_NAMESPACE";
    static final String WORKERS_VAR_NAME = "RECONCILE_WORKERS";
    static final String INITIAL_BACKOFF_VAR_NAME = "RECONCILE_BACKOFF_INITIAL";
    static final String MAX_BACKOFF_VAR_NAME = "RECONCILE_BACKOFF_MAX";
    static final String RESYNC_PERIOD_VAR_NAME = "INFORMER_RESYNC_PERIOD";
    static final String IMAGE_REPOSITORY_VAR_NAME = "WEBSITE_IMAGE_REPOSITORY";

    static final String DEFAULT_BIND_HOST = "0.0.0.0";
    static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final int DEFAULT_WORKERS = 2;
    static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(5);
    static final Duration DEFAULT_RESYNC_PERIOD = Duration.ofMinutes(10);

    public OperatorConfig {
        Objects.requireNonNull(bindHost);
        Objects.requireNonNull(initialBackoff);
        Objects.requireNonNull(maxBackoff);
        Objects.requireNonNull(resyncPeriod);
        Objects.requireNonNull(imageRepository);
        if (bindPort < 0 || bindPort > 65535) {
            throw new OperatorConfigurationException("Management port " + bindPort + " is out of range");
        }
        if (workers < 1) {
            throw new OperatorConfigurationException(WORKERS_VAR_NAME + " must be at least 1, was " + workers);
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new OperatorConfigurationException(INITIAL_BACKOFF_VAR_NAME + " must be positive, was " + initialBackoff);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new OperatorConfigurationException(MAX_BACKOFF_VAR_NAME + " (" + maxBackoff + ") must not be less than "
                    + INITIAL_BACKOFF_VAR_NAME + " (" + initialBackoff + ")");
        }
        if (resyncPeriod.isNegative()) {
            throw new OperatorConfigurationException(RESYNC_PERIOD_VAR_NAME + " must not be negative, was " + resyncPeriod);
        }
        if (imageRepository.isBlank()) {
            throw new OperatorConfigurationException(IMAGE_REPOSITORY_VAR_NAME + " must not be blank");
        }
    }

    public static OperatorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static OperatorConfig fromEnvironment(Map<String, String> env) {
        String bindHost = DEFAULT_BIND_HOST;
        int bindPort = DEFAULT_MANAGEMENT_PORT;
        String bindAddress = nonBlank(env, BIND_ADDRESS_VAR_NAME);
        if (bindAddress != null) {
            int colon = bindAddress.lastIndexOf(':');
            if (colon >= 0) {
                bindHost = bindAddress.substring(0, colon);
                bindPort = parseInt(BIND_ADDRESS_VAR_NAME, bindAddress.substring(colon + 1));
                if (bindHost.isEmpty()) {
                    throw new OperatorConfigurationException(BIND_ADDRESS_VAR_NAME + " '" + bindAddress + "' has no host");
                }
            }
            else {
                LOGGER.warn("{} env var is set but does not contain `:` assuming hostname only and binding to default port ({})",
                        BIND_ADDRESS_VAR_NAME,
                        DEFAULT_MANAGEMENT_PORT);
                bindHost = bindAddress;
            }
        }
        String workers = nonBlank(env, WORKERS_VAR_NAME);
        String initialBackoff = nonBlank(env, INITIAL_BACKOFF_VAR_NAME);
        String maxBackoff = nonBlank(env, MAX_BACKOFF_VAR_NAME);
        String resync = nonBlank(env, RESYNC_PERIOD_VAR_NAME);
        String imageRepository = nonBlank(env, IMAGE_REPOSITORY_VAR_NAME);
        return new OperatorConfig(bindHost,
                bindPort,
                nonBlank(env, WATCH_NAMESPACE_VAR_NAME),
                workers == null ? DEFAULT_WORKERS : parseInt(WORKERS_VAR_NAME, workers),
                initialBackoff == null ? DEFAULT_INITIAL_BACKOFF : parseDuration(INITIAL_BACKOFF_VAR_NAME, initialBackoff),
                maxBackoff == null ? DEFAULT_MAX_BACKOFF : parseDuration(MAX_BACKOFF_VAR_NAME, maxBackoff),
                resync == null ? DEFAULT_RESYNC_PERIOD : parseDuration(RESYNC_PERIOD_VAR_NAME, resync),
                imageRepository == null ? WebsiteResourceTemplates.DEFAULT_IMAGE_REPOSITORY : imageRepository);
    }

    public InetSocketAddress bindAddress() {
        return new InetSocketAddress(bindHost, bindPort);
    }

    @Nullable
    private static String nonBlank(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new OperatorConfigurationException(name + " '" + value + "' is not an integer", e);
        }
    }

    private static Duration parseDuration(String name, String value) {
        try {
            return Duration.parse(value);
        }
        catch (DateTimeParseException e) {
            throw new OperatorConfigurationException(name + " '" + value + "' is not an ISO-8601 duration (e.g. PT30S)", e);
        }
    }
}
