package com.lyshra.open.objects.directory.config;

import com.lyshra.open.objects.directory.impl.ObjectDirectory;
import com.lyshra.open.objects.directory.impl.ObjectLocationSubscriptionManager;
import com.lyshra.open.objects.directory.location.IObjectLocationTable;
import com.lyshra.open.objects.directory.location.LocationMergeEngine;
import com.lyshra.open.objects.directory.location.impl.InMemoryObjectLocationTable;
import com.lyshra.open.objects.directory.membership.IMembershipTable;
import com.lyshra.open.objects.directory.membership.NodeInfo;
import com.lyshra.open.objects.directory.membership.impl.InMemoryMembershipTable;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;

/**
 * Factory for creating and wiring object directory components.
 *
 * Usage:
 * <pre>
 * ObjectDirectoryConfig config = ObjectDirectoryConfig.forNode(nodeId, "10.0.0.5", 8076);
 * ObjectDirectoryRuntime runtime = ObjectDirectoryFactory.create(config);
 * runtime.initialize().block();
 * runtime.getSubscriptionManager().subscribe("pull-manager", objectId, callback).block();
 * runtime.shutdown().block();
 * </pre>
 *
 * Design Pattern: Factory Pattern - encapsulates complex object creation.
 */
@Slf4j
public final class ObjectDirectoryFactory {

    private ObjectDirectoryFactory() {
        // Utility class
    }

    /**
     * Creates a single-node runtime backed by in-memory membership and location tables.
     * The local node is registered in the membership table.
     *
     * @param config the configuration
     * @return the configured runtime
     */
    public static ObjectDirectoryRuntime create(ObjectDirectoryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();

        InMemoryMembershipTable membershipTable = new InMemoryMembershipTable(config.getSelfNodeId());
        membershipTable.registerNode(NodeInfo.alive(
                config.getSelfNodeId(), config.getNodeManagerAddress(), config.getObjectManagerPort()));

        return create(config, membershipTable, new InMemoryObjectLocationTable());
    }

    /**
     * Creates a runtime over the given collaborators with its own event loop thread.
     */
    public static ObjectDirectoryRuntime create(ObjectDirectoryConfig config,
                                                IMembershipTable membershipTable,
                                                IObjectLocationTable locationTable) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        Scheduler scheduler = Schedulers.newSingle(config.getDispatcherThreadName());
        return wire(config, membershipTable, locationTable, scheduler, true);
    }

    /**
     * Creates a runtime over the given collaborators on a caller-owned scheduler.
     * The scheduler must run tasks one at a time.
     */
    public static ObjectDirectoryRuntime create(ObjectDirectoryConfig config,
                                                IMembershipTable membershipTable,
                                                IObjectLocationTable locationTable,
                                                Scheduler scheduler) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        return wire(config, membershipTable, locationTable, Objects.requireNonNull(scheduler), false);
    }

    private static ObjectDirectoryRuntime wire(ObjectDirectoryConfig config,
                                               IMembershipTable membershipTable,
                                               IObjectLocationTable locationTable,
                                               Scheduler scheduler,
                                               boolean ownsScheduler) {
        Objects.requireNonNull(membershipTable, "membershipTable must not be null");
        Objects.requireNonNull(locationTable, "locationTable must not be null");
        if (!config.getSelfNodeId().equals(membershipTable.getSelfId())) {
            throw new IllegalStateException("Membership table belongs to node " + membershipTable.getSelfId()
                    + ", not to " + config.getSelfNodeId());
        }

        log.info("Creating object directory with config: {}", config);

        ObjectDirectory directory = new ObjectDirectory(
                membershipTable,
                new LocationMergeEngine(),
                config.isReplayStateOnSubscribe());

        ObjectLocationSubscriptionManager subscriptionManager = new ObjectLocationSubscriptionManager(
                directory,
                locationTable,
                membershipTable,
                scheduler);

        return new ObjectDirectoryRuntime(
                config,
                membershipTable,
                locationTable,
                directory,
                subscriptionManager,
                scheduler,
                ownsScheduler);
    }
}
