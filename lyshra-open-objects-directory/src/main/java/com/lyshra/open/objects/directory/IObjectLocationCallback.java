package com.lyshra.open.objects.directory;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;

import java.util.Set;

/**
 * Subscriber callback invoked whenever the merged location state of an object changes.
 *
 * Callbacks run on the directory thread and must not block.
 */
@FunctionalInterface
public interface IObjectLocationCallback {

    /**
     * @param objectId the object
     * @param locations nodes currently holding a copy (immutable)
     * @param spilledUrl spill location, empty if not spilled
     * @param spilledNodeId node that spilled the object, nil if not spilled
     * @param objectSize object size in bytes, 0 if unknown
     */
    void onLocationsChanged(ObjectId objectId, Set<NodeId> locations, String spilledUrl,
                            NodeId spilledNodeId, long objectSize);
}
