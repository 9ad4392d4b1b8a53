package com.lyshra.open.objects.directory.config;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import com.lyshra.open.objects.directory.RemoteConnectionInfo;
import com.lyshra.open.objects.directory.location.impl.InMemoryObjectLocationTable;
import com.lyshra.open.objects.directory.membership.NodeInfo;
import com.lyshra.open.objects.directory.membership.impl.InMemoryMembershipTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ObjectDirectoryFactory} and the lifecycle of the runtime it builds.
 */
class ObjectDirectoryFactoryTest {

    private ObjectDirectoryRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime == null) {
            return;
        }
        if (runtime.isInitialized()) {
            runtime.shutdown().block();
        } else if (runtime.isOwnsScheduler()) {
            runtime.getScheduler().dispose();
        }
    }

    @Test
    @DisplayName("should register the local node in the in-memory membership table")
    void shouldRegisterLocalNode() {
        NodeId selfId = NodeId.fromRandom();
        runtime = ObjectDirectoryFactory.create(ObjectDirectoryConfig.forNode(selfId, "10.0.0.5", 8076));

        NodeInfo self = runtime.getMembershipTable().get(selfId).orElseThrow();
        assertEquals("10.0.0.5", self.getNodeManagerAddress());
        assertTrue(runtime.isOwnsScheduler());

        RemoteConnectionInfo info = runtime.getDirectory().lookupRemoteConnectionInfo(selfId);
        assertTrue(info.isConnected());
        assertTrue(runtime.getDirectory().lookupAllRemoteConnections().isEmpty());
    }

    @Test
    @DisplayName("should reject a membership table of another node")
    void shouldRejectForeignMembershipTable() {
        ObjectDirectoryConfig config = ObjectDirectoryConfig.forNode(NodeId.fromRandom(), "10.0.0.5", 8076);
        InMemoryMembershipTable foreign = new InMemoryMembershipTable(NodeId.fromRandom());

        assertThrows(IllegalStateException.class, () -> ObjectDirectoryFactory.create(
                config, foreign, new InMemoryObjectLocationTable(), Schedulers.immediate()));
    }

    @Test
    @DisplayName("should reject an invalid configuration")
    void shouldRejectInvalidConfig() {
        ObjectDirectoryConfig config = ObjectDirectoryConfig.builder().selfNodeId(NodeId.nil()).build();

        assertThrows(IllegalStateException.class, () -> ObjectDirectoryFactory.create(config));
    }

    @Test
    @DisplayName("should initialize once and shut down once")
    void shouldInitializeAndShutDownOnce() {
        runtime = ObjectDirectoryFactory.create(ObjectDirectoryConfig.defaultConfig());

        StepVerifier.create(runtime.initialize()).verifyComplete();
        assertTrue(runtime.isInitialized());
        assertTrue(runtime.getSubscriptionManager().isRunning());

        StepVerifier.create(runtime.initialize()).verifyComplete();

        StepVerifier.create(runtime.shutdown()).verifyComplete();
        assertFalse(runtime.isInitialized());
        assertFalse(runtime.getSubscriptionManager().isRunning());
        assertTrue(runtime.getScheduler().isDisposed());

        StepVerifier.create(runtime.shutdown()).verifyComplete();
    }

    @Test
    @DisplayName("should leave a caller-owned scheduler running after shutdown")
    void shouldNotDisposeCallerScheduler() {
        NodeId selfId = NodeId.fromRandom();
        InMemoryMembershipTable membershipTable = new InMemoryMembershipTable(selfId);
        Scheduler scheduler = Schedulers.newSingle("caller-owned");
        try {
            runtime = ObjectDirectoryFactory.create(ObjectDirectoryConfig.forNode(selfId, "10.0.0.5", 8076),
                    membershipTable, new InMemoryObjectLocationTable(), scheduler);
            runtime.initialize().block();
            runtime.shutdown().block();

            assertFalse(scheduler.isDisposed());
        } finally {
            scheduler.dispose();
        }
    }

    @Test
    @DisplayName("should deliver location changes end to end on the event loop thread")
    void shouldDeliverEndToEnd() throws InterruptedException {
        // Given
        NodeId selfId = NodeId.fromRandom();
        NodeId remoteId = NodeId.fromRandom();
        runtime = ObjectDirectoryFactory.create(ObjectDirectoryConfig.builder()
                .selfNodeId(selfId)
                .dispatcherThreadName("directory-e2e")
                .build());
        ((InMemoryMembershipTable) runtime.getMembershipTable())
                .registerNode(NodeInfo.alive(remoteId, "10.0.0.9", 8076));
        runtime.initialize().block();

        ObjectId objectId = ObjectId.fromRandom();
        CopyOnWriteArrayList<Set<NodeId>> seen = new CopyOnWriteArrayList<>();
        CopyOnWriteArrayList<String> threads = new CopyOnWriteArrayList<>();
        CountDownLatch located = new CountDownLatch(1);
        CountDownLatch purged = new CountDownLatch(1);
        runtime.getSubscriptionManager().subscribe("pull", objectId, (o, locations, url, node, size) -> {
            seen.add(locations);
            threads.add(Thread.currentThread().getName());
            (locations.isEmpty() ? purged : located).countDown();
        }).block();

        // When
        runtime.getSubscriptionManager().reportObjectAdded(objectId, remoteId, 2048).block();
        assertTrue(located.await(5, TimeUnit.SECONDS));
        ((InMemoryMembershipTable) runtime.getMembershipTable()).markRemoved(remoteId, "node died");

        // Then
        assertTrue(purged.await(5, TimeUnit.SECONDS));
        assertEquals(Set.of(remoteId), seen.get(0));
        assertTrue(threads.stream().allMatch(name -> name.startsWith("directory-e2e")));
    }
}
