package com.lyshra.open.objects.directory.config;

import com.lyshra.open.objects.directory.IObjectDirectory;
import com.lyshra.open.objects.directory.impl.ObjectLocationSubscriptionManager;
import com.lyshra.open.objects.directory.location.IObjectLocationTable;
import com.lyshra.open.objects.directory.membership.IMembershipTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The wired object directory of one node, with its collaborators and event loop.
 *
 * Created by {@link ObjectDirectoryFactory}. Call {@link #initialize()} before use
 * and {@link #shutdown()} when done.
 */
@Slf4j
@Getter
public class ObjectDirectoryRuntime {

    private final ObjectDirectoryConfig config;
    private final IMembershipTable membershipTable;
    private final IObjectLocationTable locationTable;
    private final IObjectDirectory directory;
    private final ObjectLocationSubscriptionManager subscriptionManager;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    ObjectDirectoryRuntime(ObjectDirectoryConfig config,
                           IMembershipTable membershipTable,
                           IObjectLocationTable locationTable,
                           IObjectDirectory directory,
                           ObjectLocationSubscriptionManager subscriptionManager,
                           Scheduler scheduler,
                           boolean ownsScheduler) {
        this.config = config;
        this.membershipTable = membershipTable;
        this.locationTable = locationTable;
        this.directory = directory;
        this.subscriptionManager = subscriptionManager;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Attaches the directory to membership changes.
     *
     * @return Mono that completes when the runtime is ready
     */
    public Mono<Void> initialize() {
        if (!initialized.compareAndSet(false, true)) {
            log.warn("Object directory runtime already initialized for node: {}", config.getSelfNodeId());
            return Mono.empty();
        }

        log.info("Initializing object directory runtime for node: {}", config.getSelfNodeId());
        return subscriptionManager.start()
                .doOnSuccess(v -> log.info("Object directory runtime initialized for node: {}", config.getSelfNodeId()))
                .doOnError(e -> {
                    initialized.set(false);
                    log.error("Failed to initialize object directory runtime for node: {}",
                            config.getSelfNodeId(), e);
                });
    }

    /**
     * Closes every feed and releases the event loop thread if the runtime created it.
     *
     * @return Mono that completes when shutdown is done
     */
    public Mono<Void> shutdown() {
        if (!initialized.compareAndSet(true, false)) {
            log.warn("Object directory runtime is not initialized for node: {}", config.getSelfNodeId());
            return Mono.empty();
        }

        log.info("Shutting down object directory runtime for node: {}", config.getSelfNodeId());
        return subscriptionManager.stop()
                .doFinally(signal -> {
                    if (ownsScheduler) {
                        scheduler.dispose();
                    }
                    log.info("Object directory runtime shut down for node: {} ({})",
                            config.getSelfNodeId(), directory.getMetrics().getSummary());
                });
    }

    public boolean isInitialized() {
        return initialized.get();
    }
}
