package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The cluster metadata store's object location table, as seen by the directory.
 *
 * Nodes report copies they gain or lose and objects they spill; the directory
 * subscribes per object and receives the resulting changes as ordered batches.
 *
 * Implementations may use various backends:
 * - In-memory (for testing and single-node)
 * - A remote metadata service reached through a pub/sub channel
 *
 * Thread Safety: Implementations must be thread-safe.
 */
public interface IObjectLocationTable {

    /**
     * Records that a node holds a copy of the object.
     *
     * @param objectId the object
     * @param nodeId the node holding the copy
     * @param objectSize object size in bytes, 0 if unknown
     * @return Mono that completes once the change is recorded
     */
    Mono<Void> addLocation(ObjectId objectId, NodeId nodeId, long objectSize);

    /**
     * Records that a node no longer holds a copy of the object.
     *
     * @param objectId the object
     * @param nodeId the node that dropped the copy
     * @return Mono that completes once the change is recorded
     */
    Mono<Void> removeLocation(ObjectId objectId, NodeId nodeId);

    /**
     * Records that the object was spilled to external storage.
     *
     * @param objectId the object
     * @param spilledUrl where the object was spilled to; must not be empty
     * @param spilledNodeId the node that spilled it
     * @param objectSize object size in bytes, 0 if unknown
     * @return Mono that completes once the change is recorded
     */
    Mono<Void> reportSpilled(ObjectId objectId, String spilledUrl, NodeId spilledNodeId, long objectSize);

    /**
     * Subscribes to location changes of one object.
     *
     * The first batch describes the current state of the object (possibly empty);
     * every later batch describes one change, in the order changes were recorded.
     *
     * @param objectId the object
     * @return Flux of event batches; cancel to unsubscribe
     */
    Flux<List<LocationChangeEvent>> subscribe(ObjectId objectId);
}
