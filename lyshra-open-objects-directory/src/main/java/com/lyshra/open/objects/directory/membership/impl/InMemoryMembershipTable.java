package com.lyshra.open.objects.directory.membership.impl;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.directory.membership.IMembershipListener;
import com.lyshra.open.objects.directory.membership.IMembershipTable;
import com.lyshra.open.objects.directory.membership.MembershipEvent;
import com.lyshra.open.objects.directory.membership.NodeInfo;
import com.lyshra.open.objects.directory.membership.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of IMembershipTable for testing and single-node deployments.
 *
 * Features:
 * - Thread-safe node registration and lookup
 * - Removed nodes stay recorded as DEAD so {@link #isRemoved(NodeId)} keeps answering true
 * - Event emission to listeners and to a multicast sink
 *
 * A removal is recorded before anyone is notified, so a listener reacting to
 * NODE_REMOVED already observes {@code isRemoved(nodeId) == true}.
 *
 * Thread Safety: This class is thread-safe using ConcurrentHashMap. Sink emissions
 * are serialized so no event is lost when nodes change concurrently.
 *
 * Usage:
 * <pre>
 * InMemoryMembershipTable table = new InMemoryMembershipTable(selfId);
 * table.registerNode(NodeInfo.alive(selfId, "10.0.0.1", 8076));
 * table.markRemoved(otherId, "Heartbeat timeout");
 * </pre>
 */
@Slf4j
public class InMemoryMembershipTable implements IMembershipTable {

    private final NodeId selfId;
    private final ConcurrentHashMap<NodeId, NodeInfo> nodes;
    private final List<IMembershipListener> listeners;
    private final Sinks.Many<MembershipEvent> eventSink;
    private final Object emitLock = new Object();

    public InMemoryMembershipTable(NodeId selfId) {
        this.selfId = Objects.requireNonNull(selfId, "selfId must not be null");
        this.nodes = new ConcurrentHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
        this.eventSink = Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
    }

    // ========== Mutation ==========

    /**
     * Registers a node as a live member.
     *
     * @param info the node record
     * @return true if registered, false if the id is already known (alive or removed)
     */
    public boolean registerNode(NodeInfo info) {
        Objects.requireNonNull(info, "info must not be null");

        NodeInfo alive = info.isAlive() ? info : info.withStatus(NodeStatus.ALIVE, "Node registered");
        NodeInfo existing = nodes.putIfAbsent(info.getNodeId(), alive);
        if (existing != null) {
            if (existing.getStatus().isTerminal()) {
                log.warn("Node {} was removed and cannot rejoin", info.getNodeId());
            } else {
                log.warn("Node {} is already registered", info.getNodeId());
            }
            return false;
        }

        log.info("Registered node {} at {}", alive.getNodeId(), alive.getAddress());
        emitEvent(MembershipEvent.nodeAdded(alive));
        return true;
    }

    /**
     * Marks a node as removed from the cluster.
     *
     * @param nodeId the node id
     * @param reason why the node was removed
     * @return true if the node was alive and is now removed
     */
    public boolean markRemoved(NodeId nodeId, String reason) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        NodeInfo existing = nodes.get(nodeId);
        if (existing == null) {
            // Never seen: remember it as dead so stale references to it are purged.
            NodeInfo dead = NodeInfo.builder()
                    .nodeId(nodeId)
                    .status(NodeStatus.DEAD)
                    .statusReason(reason)
                    .build();
            if (nodes.putIfAbsent(nodeId, dead) != null) {
                return markRemoved(nodeId, reason);
            }
            log.info("Recorded unknown node {} as removed (reason: {})", nodeId, reason);
            emitEvent(MembershipEvent.nodeRemoved(dead, reason));
            return true;
        }

        if (!existing.getStatus().canTransitionTo(NodeStatus.DEAD)) {
            log.debug("Node {} is already removed", nodeId);
            return false;
        }

        NodeInfo dead = existing.withStatus(NodeStatus.DEAD, reason);
        if (!nodes.replace(nodeId, existing, dead)) {
            return markRemoved(nodeId, reason);
        }

        log.info("Node {} removed from cluster (reason: {})", nodeId, reason);
        emitEvent(MembershipEvent.nodeRemoved(dead, reason));
        return true;
    }

    // ========== Lookup ==========

    @Override
    public Optional<NodeInfo> get(NodeId nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(nodeId)).filter(NodeInfo::isAlive);
    }

    @Override
    public Map<NodeId, NodeInfo> getAll() {
        Map<NodeId, NodeInfo> alive = new LinkedHashMap<>();
        nodes.forEach((id, info) -> {
            if (info.isAlive()) {
                alive.put(id, info);
            }
        });
        return Collections.unmodifiableMap(alive);
    }

    @Override
    public NodeId getSelfId() {
        return selfId;
    }

    @Override
    public boolean isRemoved(NodeId nodeId) {
        if (nodeId == null) {
            return false;
        }
        NodeInfo info = nodes.get(nodeId);
        return info != null && info.getStatus().isTerminal();
    }

    // ========== Event Listeners ==========

    @Override
    public Flux<MembershipEvent> membershipEvents() {
        return eventSink.asFlux();
    }

    @Override
    public void addMembershipListener(IMembershipListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
    }

    @Override
    public void removeMembershipListener(IMembershipListener listener) {
        listeners.remove(listener);
    }

    private void emitEvent(MembershipEvent event) {
        // The sink rejects concurrent emitters, so registrations and removals racing
        // on different threads are serialized here.
        Sinks.EmitResult result;
        synchronized (emitLock) {
            result = eventSink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.warn("Failed to emit membership event {} ({})", event, result);
        }

        for (IMembershipListener listener : listeners) {
            try {
                listener.onMembershipChange(event);
            } catch (Exception e) {
                log.error("Error notifying membership listener of event: {}", event, e);
            }
        }
    }

    /**
     * Gets a summary of the table state.
     *
     * @return summary string
     */
    public String getSummary() {
        long alive = nodes.values().stream().filter(NodeInfo::isAlive).count();
        return String.format("InMemoryMembershipTable{self=%s, alive=%d, removed=%d}",
                selfId, alive, nodes.size() - alive);
    }
}
