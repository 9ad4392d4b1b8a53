package com.lyshra.open.objects.directory;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import com.lyshra.open.objects.directory.location.LocationChangeEvent;
import com.lyshra.open.objects.directory.location.ObjectLocationSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks, per object, which nodes hold a copy, whether it was spilled and how
 * large it is, and notifies local subscribers when that knowledge changes.
 *
 * The directory owns one location state and one ordered callback registry per
 * tracked object. An object becomes tracked on its first subscription or first
 * location update and stops being tracked when its last subscriber leaves.
 *
 * Thread Safety: Not thread-safe. All calls must come from a single thread
 * (the directory's event loop), and callbacks are invoked synchronously on it.
 */
public interface IObjectDirectory {

    // ========== Location Updates ==========

    /**
     * Merges a batch of location changes into the object's state and, if the
     * state changed, invokes the object's callbacks in registration order.
     *
     * Callback exceptions propagate to the caller.
     *
     * @param objectId the object
     * @param events events in delivery order
     * @throws com.lyshra.open.objects.core.exception.LocationConsistencyException
     *         if a spill report carries no url
     */
    void processLocationUpdate(ObjectId objectId, List<LocationChangeEvent> events);

    /**
     * Purges a removed node from every tracked object that lists it and invokes
     * those objects' callbacks. Objects not referencing the node are untouched.
     *
     * The membership table must already report the node as removed.
     *
     * @param nodeId the removed node
     */
    void handleNodeRemoved(NodeId nodeId);

    // ========== Subscriptions ==========

    /**
     * Registers a callback for an object's location changes.
     *
     * @param callbackId identity of the subscriber, unique per object
     * @param objectId the object
     * @param callback the callback
     * @return true if registered, false if the subscriber is already registered for the object
     */
    boolean subscribeObjectLocations(String callbackId, ObjectId objectId, IObjectLocationCallback callback);

    /**
     * Removes a callback. Removing the last callback of an object stops tracking it.
     *
     * @param callbackId identity of the subscriber
     * @param objectId the object
     * @return true if a callback was removed
     */
    boolean unsubscribeObjectLocations(String callbackId, ObjectId objectId);

    /**
     * Stops tracking an object, dropping its state and every callback without
     * notifying them. Used when the object's update stream failed and its state
     * can no longer be trusted.
     *
     * @param objectId the object
     * @return the number of callbacks dropped
     */
    int evictObject(ObjectId objectId);

    /**
     * Returns the merged state of a tracked object.
     *
     * @param objectId the object
     * @return snapshot of the state, empty if the object is not tracked
     */
    Optional<ObjectLocationSnapshot> lookupLocations(ObjectId objectId);

    boolean isTracked(ObjectId objectId);

    Set<ObjectId> getTrackedObjectIds();

    // ========== Connection Resolution ==========

    /**
     * Resolves a node's object manager address.
     *
     * @param nodeId the node
     * @return connection info; unconnected if the node is unknown
     */
    RemoteConnectionInfo lookupRemoteConnectionInfo(NodeId nodeId);

    /**
     * Resolves the address of every known node other than the local one.
     * Nodes whose address cannot be resolved are left out.
     *
     * @return connected infos of remote nodes
     */
    List<RemoteConnectionInfo> lookupAllRemoteConnections();

    // ========== Diagnostics ==========

    ObjectDirectoryMetrics getMetrics();

    String debugString();
}
