package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Merged knowledge about one object: where its copies are, whether it was spilled
 * and how large it is.
 *
 * Mutated only by {@link LocationMergeEngine}. Not thread-safe; owned and
 * accessed by a single directory thread.
 */
@Getter
@ToString
public final class ObjectLocationState {

    private final ObjectId objectId;
    private final Set<NodeId> locations = new HashSet<>();
    private String spilledUrl = "";
    private NodeId spilledNodeId = NodeId.nil();
    private long objectSize;

    public ObjectLocationState(ObjectId objectId) {
        this.objectId = Objects.requireNonNull(objectId, "objectId must not be null");
    }

    public Set<NodeId> getLocations() {
        return Collections.unmodifiableSet(locations);
    }

    public boolean hasLocation(NodeId nodeId) {
        return locations.contains(nodeId);
    }

    public ObjectLocationSnapshot snapshot() {
        return new ObjectLocationSnapshot(objectId, locations, spilledUrl, spilledNodeId, objectSize);
    }

    // Package-private mutators for the merge engine.

    Set<NodeId> mutableLocations() {
        return locations;
    }

    void setSpilled(String url, NodeId nodeId) {
        this.spilledUrl = url;
        this.spilledNodeId = nodeId;
    }

    void setObjectSize(long objectSize) {
        this.objectSize = objectSize;
    }
}
