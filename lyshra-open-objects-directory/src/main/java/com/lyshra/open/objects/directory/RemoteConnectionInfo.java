package com.lyshra.open.objects.directory;

import com.lyshra.open.objects.core.id.NodeId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * How to reach a node's object manager for data transfer.
 *
 * Computed on demand from the membership table and never cached. A node that
 * the table does not know yields an unconnected instance.
 */
@Getter
@Builder
@ToString
public final class RemoteConnectionInfo {

    private final NodeId nodeId;
    private final String ip;
    private final int port;

    private RemoteConnectionInfo(NodeId nodeId, String ip, int port) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.ip = ip != null ? ip : "";
        this.port = port;
    }

    public static RemoteConnectionInfo unconnected(NodeId nodeId) {
        return RemoteConnectionInfo.builder().nodeId(nodeId).build();
    }

    /**
     * Checks if an address was resolved for the node.
     */
    public boolean isConnected() {
        return !ip.isEmpty() && port > 0;
    }
}
