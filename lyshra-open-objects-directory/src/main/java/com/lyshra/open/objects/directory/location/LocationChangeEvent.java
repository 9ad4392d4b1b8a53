package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.id.NodeId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One observed fact about an object, as delivered by the metadata store.
 *
 * An event is either a location change (a node id with an add/remove flag) or a
 * spill report (a spill URL and the node that performed the spill), never both.
 * A size of 0 means the size was not provided.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder
@ToString
public final class LocationChangeEvent {

    /**
     * Node whose copy was added or removed; nil for spill reports.
     */
    private final NodeId nodeId;

    /**
     * True for an added copy, false for a removed one. Ignored for spill reports.
     */
    private final boolean add;

    /**
     * Object size in bytes, 0 if unknown.
     */
    private final long size;

    /**
     * Spill location; empty for location changes.
     */
    private final String spilledUrl;

    /**
     * Node that spilled the object; nil if unknown or not a spill report.
     */
    private final NodeId spilledNodeId;

    private LocationChangeEvent(NodeId nodeId, boolean add, long size, String spilledUrl, NodeId spilledNodeId) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
        this.nodeId = nodeId != null ? nodeId : NodeId.nil();
        this.add = add;
        this.size = size;
        this.spilledUrl = spilledUrl != null ? spilledUrl : "";
        this.spilledNodeId = spilledNodeId != null ? spilledNodeId : NodeId.nil();
        if (!this.nodeId.isNil() && !this.spilledUrl.isEmpty()) {
            throw new IllegalArgumentException(
                    "A location change event carries either a node id or a spilled url, not both");
        }
    }

    // ========== Factory Methods ==========

    public static LocationChangeEvent added(NodeId nodeId, long size) {
        return LocationChangeEvent.builder().nodeId(nodeId).add(true).size(size).build();
    }

    public static LocationChangeEvent removed(NodeId nodeId) {
        return LocationChangeEvent.builder().nodeId(nodeId).add(false).build();
    }

    public static LocationChangeEvent spilled(String spilledUrl, NodeId spilledNodeId, long size) {
        return LocationChangeEvent.builder()
                .spilledUrl(spilledUrl)
                .spilledNodeId(spilledNodeId)
                .size(size)
                .build();
    }

    /**
     * Checks if this event reports a location add/remove (as opposed to a spill).
     */
    public boolean hasNodeId() {
        return !nodeId.isNil();
    }
}
