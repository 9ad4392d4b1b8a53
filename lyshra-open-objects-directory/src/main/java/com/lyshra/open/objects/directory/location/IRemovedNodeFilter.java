package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.id.NodeId;

/**
 * Answers whether a node has left the cluster. Used by the merge engine to purge
 * locations that point at removed nodes.
 *
 * {@code IMembershipTable::isRemoved} satisfies this interface.
 */
@FunctionalInterface
public interface IRemovedNodeFilter {

    boolean isRemoved(NodeId nodeId);
}
