/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import io.kubesite.kubernetes.api.v1.Website;
import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Watches {@code Website}s and the {@code Deployment}s and {@code Service}s labelled as belonging to one,
 * and turns every add, update and delete into the identity of the {@code Website} to reconcile.
 * Owned resources are mapped to their owner through their labels.
 */
public class WebsiteEventSource implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebsiteEventSource.class);

    private final KubernetesClient client;
    @Nullable
    private final String namespace;
    private final Duration resyncPeriod;
    private final Consumer<ResourceIdentity> sink;
    private final List<SharedIndexInformer<?>> informers = new ArrayList<>();

    public WebsiteEventSource(KubernetesClient client, @Nullable String namespace, Duration resyncPeriod, Consumer<ResourceIdentity> sink) {
        this.client = Objects.requireNonNull(client);
        this.namespace = namespace;
        this.resyncPeriod = Objects.requireNonNull(resyncPeriod);
        this.sink = Objects.requireNonNull(sink);
    }

    /**
     * Starts the informers, and returns once their caches are synced.
     */
    public synchronized void start() {
        if (!informers.isEmpty()) {
            throw new IllegalStateException("Event source has already been started");
        }
        informers.add(informer(Website.class, null, website -> Optional.of(ResourceIdentity.of(website))));
        informers.add(informer(Deployment.class, Labels.typeSelector(), Labels::owner));
        informers.add(informer(Service.class, Labels.typeSelector(), Labels::owner));
        informers.forEach(i -> i.start().toCompletableFuture().join());
        LOGGER.info("Watching Websites in {}", namespace == null ? "all namespaces" : "namespace " + namespace);
    }

    /**
     * @return true if every informer is started and watching.
     */
    public synchronized boolean isWatching() {
        return !informers.isEmpty() && informers.stream().allMatch(SharedIndexInformer::isWatching);
    }

    @Override
    public synchronized void close() {
        informers.forEach(SharedIndexInformer::stop);
        informers.clear();
    }

    private <T extends HasMetadata> SharedIndexInformer<T> informer(Class<T> type,
                                                                 @Nullable Map<String, String> labels,
                                                                 Function<T, Optional<ResourceIdentity>> toWebsite) {
        SharedIndexInformer<T> informer = runnableInformer(type, labels);
        informer.addEventHandler(new MappingHandler<>(HasMetadata.getKind(type), toWebsite, sink));
        return informer;
    }

    private <T extends HasMetadata> SharedIndexInformer<T> runnableInformer(Class<T> type, @Nullable Map<String, String> labels) {
        long resyncMillis = resyncPeriod.toMillis();
        var resources = client.resources(type);
        if (namespace == null) {
            return labels == null ? resources.inAnyNamespace().runnableInformer(resyncMillis)
                    : resources.inAnyNamespace().withLabels(labels).runnableInformer(resyncMillis);
        }
        return labels == null ? resources.inNamespace(namespace).runnableInformer(resyncMillis)
                : resources.inNamespace(namespace).withLabels(labels).runnableInformer(resyncMillis);
    }

    private record MappingHandler<T extends HasMetadata>(String kind,
                                                        Function<T, Optional<ResourceIdentity>> toWebsite,
                                                        Consumer<ResourceIdentity> sink)
            implements ResourceEventHandler<T> {

        @Override
        public void onAdd(T obj) {
            notify("added", obj);
        }

        @Override
        public void onUpdate(T oldObj, T newObj) {
            if (isResync(oldObj, newObj)) {
                LOGGER.trace("Ignoring resync of {} {}", kind, ResourceIdentity.of(newObj));
                return;
            }
            notify("updated", newObj);
        }

        // a resync replays the cached object, so nothing about it has changed
        private static boolean isResync(HasMetadata oldObj, HasMetadata newObj) {
            String oldVersion = oldObj.getMetadata().getResourceVersion();
            return oldVersion != null && oldVersion.equals(newObj.getMetadata().getResourceVersion());
        }

        @Override
        public void onDelete(T obj, boolean deletedFinalStateUnknown) {
            notify("deleted", obj);
        }

        private void notify(String event, T obj) {
            Optional<ResourceIdentity> website = toWebsite.apply(obj);
            if (website.isPresent()) {
                LOGGER.atDebug().setMessage("{} {} {}, enqueuing Website {}")
                        .addArgument(kind)
                        .addArgument(() -> ResourceIdentity.of(obj))
                        .addArgument(event)
                        .addArgument(website.get())
                        .log();
                sink.accept(website.get());
            }
            else {
                LOGGER.debug("Ignoring {} {} without a Website owner", event, kind);
            }
        }
    }
}
