/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.io.IOException;
import java.util.Properties;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.kubesite.kubernetes.operator.cluster.Fabric8ClusterClient;
import io.kubesite.kubernetes.operator.dispatch.ExponentialBackoff;
import io.kubesite.kubernetes.operator.dispatch.ReconcileDispatcher;
import io.kubesite.kubernetes.operator.management.MethodNotAllowedFilter;
import io.kubesite.tag.VisibleForTesting;

/**
 * The {@code main} method entrypoint for the operator
 */
public class OperatorMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorMain.class);
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";

    private final OperatorConfig config;
    private final HttpServer managementServer;
    private final ReconcileDispatcher dispatcher;
    private final WebsiteEventSource eventSource;

    @VisibleForTesting
    OperatorMain(OperatorConfig config, KubernetesClient kubeClient, HttpServer managementServer) {
        this(config, kubeClient, managementServer, configurePrometheusMetrics(managementServer));
    }

    @VisibleForTesting
    OperatorMain(OperatorConfig config, KubernetesClient kubeClient, HttpServer managementServer, MeterRegistry meterRegistry) {
        this.config = config;
        this.managementServer = managementServer;
        var reconciler = new WebsiteReconciler(new Fabric8ClusterClient(kubeClient), new WebsiteResourceTemplates(config.imageRepository()));
        this.dispatcher = new ReconcileDispatcher(reconciler, new ExponentialBackoff(config.initialBackoff(), config.maxBackoff()), meterRegistry);
        this.eventSource = new WebsiteEventSource(kubeClient, config.watchNamespace(), config.resyncPeriod(), dispatcher::enqueue);
    }

    public static void main(String[] args) {
        KubernetesClient kubeClient = null;
        try {
            OperatorConfig config = OperatorConfig.fromEnvironment();
            kubeClient = new KubernetesClientBuilder().build();
            OperatorMain operator = new OperatorMain(config, kubeClient, createHttpServer(config));
            KubernetesClient client = kubeClient;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                operator.stop();
                client.close();
            }, "kubesite-shutdown"));
            operator.start();
        }
        catch (Exception e) {
            LOGGER.error("Operator has thrown exception during startup. Will now exit.", e);
            if (kubeClient != null) {
                kubeClient.close();
            }
            System.exit(1);
        }
    }

    /**
     * Starts the operator instance and returns once that has completed successfully.
     */
    void start() {
        addHttpGetHandler("/", () -> 404);
        managementServer.start();
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        dispatcher.run(config.workers());
        eventSource.start();
        LOGGER.atInfo().setMessage("Operator started (workers: {}, namespace: {}, image repository: {})")
                .addArgument(config::workers)
                .addArgument(() -> config.watchNamespace() == null ? "<all>" : config.watchNamespace())
                .addArgument(config::imageRepository)
                .log();
    }

    private void addHttpGetHandler(
                                   String path,
                                   IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(MethodNotAllowedFilter.GET_ONLY);
    }

    private int livezStatusCode() {
        int sc;
        try {
            sc = eventSource.isWatching() && dispatcher.isRunning() ? 200 : 400;
        }
        catch (Exception e) {
            sc = 400;
            LOGGER.error("Ignoring exception caught while getting operator health info", e);
        }
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, HTTP_PATH_LIVEZ);
        return sc;
    }

    void stop() {
        eventSource.close();
        dispatcher.close();
        managementServer.stop(0);
        LOGGER.info("Operator stopped.");
    }

    private static MeterRegistry configurePrometheusMetrics(HttpServer managementServer) {
        final PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final HttpContext metricsContext = managementServer.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(MethodNotAllowedFilter.GET_ONLY);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
        return Metrics.globalRegistry;
    }

    @VisibleForTesting
    static HttpServer createHttpServer(OperatorConfig config) throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }

        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }

        LOGGER.info("Starting management server on: {}:{}", config.bindHost(), config.bindPort());
        return HttpServer.create(config.bindAddress(), 0);
    }
}
