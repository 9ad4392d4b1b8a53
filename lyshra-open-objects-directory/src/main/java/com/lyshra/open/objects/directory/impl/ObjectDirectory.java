package com.lyshra.open.objects.directory.impl;

import com.lyshra.open.objects.core.exception.LyshraOpenObjectsRuntimeException;
import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import com.lyshra.open.objects.directory.IObjectDirectory;
import com.lyshra.open.objects.directory.IObjectLocationCallback;
import com.lyshra.open.objects.directory.ObjectDirectoryMetrics;
import com.lyshra.open.objects.directory.RemoteConnectionInfo;
import com.lyshra.open.objects.directory.location.LocationChangeEvent;
import com.lyshra.open.objects.directory.location.LocationMergeEngine;
import com.lyshra.open.objects.directory.location.ObjectLocationSnapshot;
import com.lyshra.open.objects.directory.location.ObjectLocationState;
import com.lyshra.open.objects.directory.membership.IMembershipTable;
import com.lyshra.open.objects.directory.membership.NodeInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Default IObjectDirectory implementation.
 *
 * Owns one {@link ObjectLocationState} and one ordered callback registry per
 * tracked object and is the only caller of the {@link LocationMergeEngine}.
 * Every instance is independent; nothing is shared through static state.
 *
 * Thread Safety: Not thread-safe. Confined to the directory's event loop thread,
 * see {@link ObjectLocationSubscriptionManager}.
 *
 * Usage:
 * <pre>
 * ObjectDirectory directory = new ObjectDirectory(membershipTable);
 * directory.subscribeObjectLocations("pull-manager", objectId, callback);
 * directory.processLocationUpdate(objectId, List.of(LocationChangeEvent.added(nodeId, 1024)));
 * </pre>
 */
@Slf4j
public class ObjectDirectory implements IObjectDirectory {

    private final IMembershipTable membershipTable;
    private final LocationMergeEngine mergeEngine;
    private final boolean replayStateOnSubscribe;
    private final Map<ObjectId, LocationListenerState> listeners = new LinkedHashMap<>();
    private final ObjectDirectoryMetrics metrics = new ObjectDirectoryMetrics();

    public ObjectDirectory(IMembershipTable membershipTable) {
        this(membershipTable, new LocationMergeEngine(), true);
    }

    public ObjectDirectory(IMembershipTable membershipTable,
                           LocationMergeEngine mergeEngine,
                           boolean replayStateOnSubscribe) {
        this.membershipTable = Objects.requireNonNull(membershipTable, "membershipTable must not be null");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine must not be null");
        this.replayStateOnSubscribe = replayStateOnSubscribe;
    }

    // ========== Location Updates ==========

    @Override
    public void processLocationUpdate(ObjectId objectId, List<LocationChangeEvent> events) {
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(events, "events must not be null");

        LocationListenerState listener = listeners.computeIfAbsent(objectId, LocationListenerState::new);
        boolean changed = mergeEngine.merge(events, listener.state, membershipTable::isRemoved);
        listener.receivedUpdate = true;
        metrics.recordLocationUpdate(events.size(), changed);

        log.debug("Merged {} location events for object {} (changed: {}, locations: {})",
                events.size(), objectId, changed, listener.state.getLocations().size());

        if (changed) {
            notifyCallbacks(listener);
        }
    }

    @Override
    public void handleNodeRemoved(NodeId nodeId) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        int affected = 0;
        // Callbacks may (un)subscribe, so walk a copy of the keys and re-resolve each entry.
        for (ObjectId objectId : new ArrayList<>(listeners.keySet())) {
            LocationListenerState listener = listeners.get(objectId);
            if (listener == null || !listener.state.hasLocation(nodeId)) {
                continue;
            }

            // Empty batch: only the membership purge can act. The purge does not
            // report a change, so the location check above stands in for it.
            mergeEngine.merge(List.of(), listener.state, membershipTable::isRemoved);
            if (listener.state.hasLocation(nodeId)) {
                log.warn("Node {} is still listed for object {}: membership table does not report it removed",
                        nodeId, objectId);
            }
            affected++;
            notifyCallbacks(listener);
        }

        metrics.recordNodeRemoval(affected);
        log.info("Handled removal of node {} ({} tracked objects affected)", nodeId, affected);
    }

    // ========== Subscriptions ==========

    @Override
    public boolean subscribeObjectLocations(String callbackId, ObjectId objectId, IObjectLocationCallback callback) {
        Objects.requireNonNull(callbackId, "callbackId must not be null");
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(callback, "callback must not be null");

        LocationListenerState listener = listeners.computeIfAbsent(objectId, LocationListenerState::new);
        if (listener.callbacks.containsKey(callbackId)) {
            log.warn("Callback {} is already subscribed to object {}", callbackId, objectId);
            return false;
        }

        listener.callbacks.put(callbackId, callback);
        metrics.recordSubscriptionAdded();
        if (listener.callbacks.size() == 1) {
            log.info("Callback {} is the first subscriber of object {}", callbackId, objectId);
        } else {
            log.debug("Callback {} subscribed to object {} ({} subscribers)",
                    callbackId, objectId, listener.callbacks.size());
        }

        if (replayStateOnSubscribe && listener.receivedUpdate) {
            ObjectLocationSnapshot snapshot = listener.state.snapshot();
            invoke(callback, snapshot);
            metrics.recordCallbacks(1);
        }
        return true;
    }

    @Override
    public boolean unsubscribeObjectLocations(String callbackId, ObjectId objectId) {
        Objects.requireNonNull(callbackId, "callbackId must not be null");
        Objects.requireNonNull(objectId, "objectId must not be null");

        LocationListenerState listener = listeners.get(objectId);
        if (listener == null || listener.callbacks.remove(callbackId) == null) {
            log.warn("Callback {} is not subscribed to object {}", callbackId, objectId);
            return false;
        }

        metrics.recordSubscriptionsRemoved(1);
        if (listener.callbacks.isEmpty()) {
            listeners.remove(objectId);
            log.info("Last subscriber {} left, object {} is no longer tracked", callbackId, objectId);
        }
        return true;
    }

    @Override
    public int evictObject(ObjectId objectId) {
        Objects.requireNonNull(objectId, "objectId must not be null");

        LocationListenerState listener = listeners.remove(objectId);
        if (listener == null) {
            return 0;
        }
        int dropped = listener.callbacks.size();
        metrics.recordSubscriptionsRemoved(dropped);
        log.warn("Evicted object {} with {} subscribers", objectId, dropped);
        return dropped;
    }

    @Override
    public Optional<ObjectLocationSnapshot> lookupLocations(ObjectId objectId) {
        LocationListenerState listener = listeners.get(objectId);
        return listener != null ? Optional.of(listener.state.snapshot()) : Optional.empty();
    }

    @Override
    public boolean isTracked(ObjectId objectId) {
        return listeners.containsKey(objectId);
    }

    @Override
    public Set<ObjectId> getTrackedObjectIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(listeners.keySet()));
    }

    /**
     * Returns the number of callbacks registered for an object.
     */
    public int getSubscriberCount(ObjectId objectId) {
        LocationListenerState listener = listeners.get(objectId);
        return listener != null ? listener.callbacks.size() : 0;
    }

    // ========== Connection Resolution ==========

    @Override
    public RemoteConnectionInfo lookupRemoteConnectionInfo(NodeId nodeId) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        Optional<NodeInfo> nodeInfo = membershipTable.get(nodeId);
        if (nodeInfo.isEmpty()) {
            return RemoteConnectionInfo.unconnected(nodeId);
        }

        NodeInfo info = nodeInfo.get();
        if (!nodeId.equals(info.getNodeId())) {
            throw new LyshraOpenObjectsRuntimeException(
                    "Membership table returned node " + info.getNodeId() + " for lookup of " + nodeId);
        }
        return RemoteConnectionInfo.builder()
                .nodeId(nodeId)
                .ip(info.getNodeManagerAddress())
                .port(info.getObjectManagerPort())
                .build();
    }

    @Override
    public List<RemoteConnectionInfo> lookupAllRemoteConnections() {
        NodeId selfId = membershipTable.getSelfId();
        List<RemoteConnectionInfo> remoteConnections = new ArrayList<>();
        for (NodeId nodeId : membershipTable.getAll().keySet()) {
            RemoteConnectionInfo info = lookupRemoteConnectionInfo(nodeId);
            if (info.isConnected() && !nodeId.equals(selfId)) {
                remoteConnections.add(info);
            }
        }
        return remoteConnections;
    }

    // ========== Diagnostics ==========

    @Override
    public ObjectDirectoryMetrics getMetrics() {
        return metrics;
    }

    @Override
    public String debugString() {
        int callbacks = listeners.values().stream().mapToInt(l -> l.callbacks.size()).sum();
        return String.format("ObjectDirectory{trackedObjects=%d, callbacks=%d, %s}",
                listeners.size(), callbacks, metrics.getSummary());
    }

    private void notifyCallbacks(LocationListenerState listener) {
        ObjectLocationSnapshot snapshot = listener.state.snapshot();
        List<IObjectLocationCallback> callbacks = new ArrayList<>(listener.callbacks.values());
        for (IObjectLocationCallback callback : callbacks) {
            invoke(callback, snapshot);
        }
        metrics.recordCallbacks(callbacks.size());
    }

    private static void invoke(IObjectLocationCallback callback, ObjectLocationSnapshot snapshot) {
        callback.onLocationsChanged(snapshot.objectId(), snapshot.locations(), snapshot.spilledUrl(),
                snapshot.spilledNodeId(), snapshot.objectSize());
    }

    private static final class LocationListenerState {
        private final ObjectLocationState state;
        private final Map<String, IObjectLocationCallback> callbacks = new LinkedHashMap<>();
        private boolean receivedUpdate;

        private LocationListenerState(ObjectId objectId) {
            this.state = new ObjectLocationState(objectId);
        }
    }
}
