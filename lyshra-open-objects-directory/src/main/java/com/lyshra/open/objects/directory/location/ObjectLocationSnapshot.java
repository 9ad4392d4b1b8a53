package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable copy of an object's merged location state.
 *
 * @param objectId the object
 * @param locations nodes holding a copy
 * @param spilledUrl spill location, empty if not spilled
 * @param spilledNodeId node that spilled the object, nil if not spilled
 * @param objectSize size in bytes, 0 if unknown
 */
public record ObjectLocationSnapshot(
        ObjectId objectId,
        Set<NodeId> locations,
        String spilledUrl,
        NodeId spilledNodeId,
        long objectSize
) {

    public ObjectLocationSnapshot {
        Objects.requireNonNull(objectId, "objectId must not be null");
        locations = Set.copyOf(locations);
        spilledUrl = spilledUrl != null ? spilledUrl : "";
        spilledNodeId = spilledNodeId != null ? spilledNodeId : NodeId.nil();
    }

    public boolean isSpilled() {
        return !spilledUrl.isEmpty();
    }

    public boolean isSizeKnown() {
        return objectSize > 0;
    }
}
