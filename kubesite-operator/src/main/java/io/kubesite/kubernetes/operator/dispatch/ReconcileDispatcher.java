/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.dispatch;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import io.kubesite.kubernetes.operator.ReconcileOutcome;
import io.kubesite.kubernetes.operator.Reconciler;
import io.kubesite.kubernetes.operator.cluster.ResourceIdentity;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Feeds change notifications to a {@link Reconciler} from a fixed pool of worker threads.
 * <p>
 * Notifications are keyed by identity and collapse while pending. A given identity is
 * reconciled by at most one worker at a time, distinct identities proceed in parallel.
 * Retryable outcomes are re-enqueued after an exponential backoff. Fatal outcomes are
 * logged and dropped until the next notification for that identity.
 * The dispatcher itself makes no cluster calls.
 */
public class ReconcileDispatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconcileDispatcher.class);
    static final String RECONCILIATIONS_METRIC = "kubesite.reconciliations";
    static final String RECONCILIATION_DURATION_METRIC = "kubesite.reconciliation.duration";
    static final String QUEUE_DEPTH_METRIC = "kubesite.workqueue.depth";
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final Reconciler reconciler;
    private final ExponentialBackoff backoff;
    private final KeyedWorkQueue<ResourceIdentity> queue = new KeyedWorkQueue<>();
    private final Map<ResourceIdentity, Integer> consecutiveFailures = new ConcurrentHashMap<>();
    private final ScheduledExecutorService retryScheduler;
    private final Counter convergedCounter;
    private final Counter retryableCounter;
    private final Counter fatalCounter;
    private final Timer reconciliationTimer;
    private final MeterRegistry meterRegistry;

    @Nullable
    private volatile ExecutorService workers;

    public ReconcileDispatcher(Reconciler reconciler, ExponentialBackoff backoff, MeterRegistry meterRegistry) {
        this.reconciler = Objects.requireNonNull(reconciler);
        this.backoff = Objects.requireNonNull(backoff);
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("kubesite-retry-", true));
        this.convergedCounter = outcomeCounter("converged");
        this.retryableCounter = outcomeCounter("retryable");
        this.fatalCounter = outcomeCounter("fatal");
        this.reconciliationTimer = Timer.builder(RECONCILIATION_DURATION_METRIC)
                .description("Time taken by one reconciliation of a Website")
                .register(meterRegistry);
        Gauge.builder(QUEUE_DEPTH_METRIC, queue, KeyedWorkQueue::size)
                .description("Websites waiting to be reconciled")
                .register(meterRegistry);
    }

    private Counter outcomeCounter(String outcome) {
        return Counter.builder(RECONCILIATIONS_METRIC)
                .description("Completed reconciliations of Websites by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    /**
     * Requests a reconciliation of the given identity. Safe to call from any thread, including informer callbacks.
     */
    public void enqueue(ResourceIdentity identity) {
        if (queue.add(identity)) {
            LOGGER.debug("Enqueued {}", identity);
        }
        else {
            LOGGER.debug("{} is already enqueued, ignoring", identity);
        }
    }

    /**
     * Starts {@code workerCount} workers and returns immediately.
     */
    public synchronized void run(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, was " + workerCount);
        }
        if (workers != null) {
            throw new IllegalStateException("Dispatcher has already been started");
        }
        ExecutorService pool = Executors.newFixedThreadPool(workerCount, threadFactory("kubesite-reconciler-", false));
        for (int i = 0; i < workerCount; i++) {
            pool.execute(this::work);
        }
        workers = pool;
        LOGGER.info("Started {} reconciliation worker(s)", workerCount);
    }

    public boolean isRunning() {
        ExecutorService pool = workers;
        return pool != null && !pool.isShutdown();
    }

    /**
     * @return The number of identities waiting to be reconciled.
     */
    public int pending() {
        return queue.size();
    }

    private void work() {
        while (!Thread.currentThread().isInterrupted()) {
            ResourceIdentity identity;
            try {
                identity = queue.take();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (identity == null) {
                break;
            }
            try {
                process(identity);
            }
            finally {
                queue.done(identity);
            }
        }
        LOGGER.debug("Worker {} exiting", Thread.currentThread().getName());
    }

    void process(ResourceIdentity identity) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ReconcileOutcome outcome;
        try {
            outcome = reconciler.reconcile(identity);
        }
        catch (CancellationException e) {
            LOGGER.info("Reconciliation of {} was cancelled", identity);
            return;
        }
        catch (RuntimeException e) {
            LOGGER.warn("Reconciliation of {} failed unexpectedly, will retry", identity, e);
            outcome = ReconcileOutcome.retryable(e.toString());
        }
        finally {
            sample.stop(reconciliationTimer);
        }
        onOutcome(identity, outcome);
    }

    private void onOutcome(ResourceIdentity identity, ReconcileOutcome outcome) {
        if (outcome instanceof ReconcileOutcome.Retryable retryable) {
            retryableCounter.increment();
            int attempt = consecutiveFailures.merge(identity, 1, Integer::sum);
            Duration delay = backoff.delay(attempt);
            LOGGER.debug("Reconciliation of {} will be retried in {} (attempt {}): {}", identity, delay, attempt, retryable.reason());
            scheduleRetry(identity, delay);
        }
        else if (outcome instanceof ReconcileOutcome.Fatal fatal) {
            fatalCounter.increment();
            consecutiveFailures.remove(identity);
            LOGGER.error("Reconciliation of Website {} failed and will not be retried until it changes: {}", identity, fatal.reason());
        }
        else {
            convergedCounter.increment();
            consecutiveFailures.remove(identity);
        }
    }

    private void scheduleRetry(ResourceIdentity identity, Duration delay) {
        try {
            retryScheduler.schedule(() -> enqueue(identity), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (RejectedExecutionException e) {
            LOGGER.debug("Not scheduling retry of {}, dispatcher is closed", identity);
        }
    }

    /**
     * Stops accepting work, cancels scheduled retries and interrupts in-flight reconciliations.
     */
    @Override
    public synchronized void close() {
        queue.shutDown();
        retryScheduler.shutdownNow();
        ExecutorService pool = workers;
        if (pool == null || pool.isShutdown()) {
            return;
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Reconciliation workers did not stop within {}", SHUTDOWN_TIMEOUT);
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Reconciliation workers stopped");
    }

    private static ThreadFactory threadFactory(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
