package com.lyshra.open.objects.directory.membership;

import com.lyshra.open.objects.core.id.NodeId;

import java.time.Instant;
import java.util.Objects;

/**
 * Change notification emitted by the membership table.
 */
public record MembershipEvent(
        EventType type,
        NodeId nodeId,
        NodeInfo nodeInfo,
        String reason,
        Instant timestamp
) {

    public enum EventType {
        NODE_ADDED,
        NODE_REMOVED
    }

    public MembershipEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static MembershipEvent nodeAdded(NodeInfo info) {
        return new MembershipEvent(EventType.NODE_ADDED, info.getNodeId(), info, "Node registered", Instant.now());
    }

    public static MembershipEvent nodeRemoved(NodeInfo info, String reason) {
        return new MembershipEvent(EventType.NODE_REMOVED, info.getNodeId(), info, reason, Instant.now());
    }

    public boolean isRemoval() {
        return type == EventType.NODE_REMOVED;
    }
}
