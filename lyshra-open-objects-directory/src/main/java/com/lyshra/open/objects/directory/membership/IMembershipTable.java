package com.lyshra.open.objects.directory.membership;

import com.lyshra.open.objects.core.id.NodeId;
import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.Optional;

/**
 * Read-side view of cluster membership consumed by the object directory.
 *
 * The membership table is the source of truth for which nodes are part of
 * the cluster and how to reach them. The directory never mutates it; it only
 * queries it synchronously while merging location updates, so implementations
 * must answer from memory without blocking.
 *
 * Implementations may be backed by:
 * - In-memory state (for testing and single-node)
 * - A cache fed by the cluster metadata store
 */
public interface IMembershipTable {

    /**
     * Looks up a live node.
     *
     * @param nodeId the node id
     * @return the node record, empty if the node is unknown or removed
     */
    Optional<NodeInfo> get(NodeId nodeId);

    /**
     * Returns every live node keyed by id.
     *
     * @return snapshot of the live nodes
     */
    Map<NodeId, NodeInfo> getAll();

    /**
     * Returns the id of the local node.
     *
     * @return the local node id
     */
    NodeId getSelfId();

    /**
     * Checks whether a node has been removed from the cluster.
     *
     * A node that was never seen is not "removed".
     *
     * @param nodeId the node id
     * @return true if the node was removed
     */
    boolean isRemoved(NodeId nodeId);

    /**
     * Hot stream of membership changes.
     *
     * @return Flux of membership events
     */
    Flux<MembershipEvent> membershipEvents();

    void addMembershipListener(IMembershipListener listener);

    void removeMembershipListener(IMembershipListener listener);
}
