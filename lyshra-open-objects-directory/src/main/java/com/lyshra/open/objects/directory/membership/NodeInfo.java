package com.lyshra.open.objects.directory.membership;

import com.lyshra.open.objects.core.id.NodeId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable membership record of a cluster node.
 *
 * Holds what the object directory needs to reach a node for data transfer:
 * the node manager address and the object manager port.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class NodeInfo {

    private final NodeId nodeId;

    /**
     * Address (IP or hostname) the node's object manager is reachable at.
     */
    private final String nodeManagerAddress;

    /**
     * Port of the node's object manager.
     */
    private final int objectManagerPort;

    private final NodeStatus status;
    private final Instant registeredAt;
    private final Instant statusChangedAt;
    private final String statusReason;

    private NodeInfo(NodeId nodeId, String nodeManagerAddress, int objectManagerPort,
                     NodeStatus status, Instant registeredAt, Instant statusChangedAt,
                     String statusReason) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.nodeManagerAddress = nodeManagerAddress != null ? nodeManagerAddress : "";
        this.objectManagerPort = objectManagerPort;
        this.status = status != null ? status : NodeStatus.ALIVE;
        this.registeredAt = registeredAt != null ? registeredAt : Instant.now();
        this.statusChangedAt = statusChangedAt != null ? statusChangedAt : this.registeredAt;
        this.statusReason = statusReason;
    }

    /**
     * Creates an alive node record.
     *
     * @param nodeId the node id
     * @param address the node manager address
     * @param port the object manager port
     * @return a new NodeInfo
     */
    public static NodeInfo alive(NodeId nodeId, String address, int port) {
        return NodeInfo.builder()
                .nodeId(nodeId)
                .nodeManagerAddress(address)
                .objectManagerPort(port)
                .status(NodeStatus.ALIVE)
                .build();
    }

    public boolean isAlive() {
        return status == NodeStatus.ALIVE;
    }

    /**
     * Creates a copy with updated status.
     *
     * @param newStatus the new status
     * @param reason why the status changed
     * @return a new NodeInfo with the status applied
     */
    public NodeInfo withStatus(NodeStatus newStatus, String reason) {
        return this.toBuilder()
                .status(newStatus)
                .statusReason(reason)
                .statusChangedAt(Instant.now())
                .build();
    }

    /**
     * Gets the address in host:port format.
     */
    public String getAddress() {
        return nodeManagerAddress + ":" + objectManagerPort;
    }
}
