package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.exception.LocationConsistencyException;
import com.lyshra.open.objects.core.id.NodeId;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Folds a batch of location change events into an object's accumulated state.
 *
 * The batch is applied as a diff: {@code state} must already hold the result of
 * every earlier batch for the object, so the cost is proportional to the batch
 * size and not to the object's update history.
 *
 * After the events are applied, every location the filter reports as removed is
 * purged. The purge runs on every call, including empty batches, and does not
 * contribute to the returned flag. Callers that need to notify on
 * membership-driven removals must detect them on their own (see
 * {@code ObjectDirectory#handleNodeRemoved}).
 *
 * Thread Safety: Stateless; the state passed in must not be shared across threads.
 */
@Slf4j
public final class LocationMergeEngine {

    /**
     * Applies the events to the state.
     *
     * @param events events in delivery order
     * @param state accumulated state of the object, mutated in place
     * @param removedNodeFilter membership check used to purge stale locations
     * @return true if the events changed the locations or the spill url
     * @throws LocationConsistencyException if a spill report carries no url
     */
    public boolean merge(List<LocationChangeEvent> events,
                         ObjectLocationState state,
                         IRemovedNodeFilter removedNodeFilter) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(removedNodeFilter, "removedNodeFilter must not be null");

        boolean changed = false;
        for (LocationChangeEvent event : events) {
            // 0 means "not provided"; deletions usually carry no size.
            if (event.getSize() > 0) {
                state.setObjectSize(event.getSize());
            }

            if (event.hasNodeId()) {
                NodeId nodeId = event.getNodeId();
                if (event.isAdd()) {
                    changed |= state.mutableLocations().add(nodeId);
                } else {
                    changed |= state.mutableLocations().remove(nodeId);
                }
            } else {
                if (event.getSpilledUrl().isEmpty()) {
                    throw new LocationConsistencyException(
                            "Spill report without a spilled url", state.getObjectId());
                }
                log.debug("Received object {} spilled at {} by node {}",
                        state.getObjectId(), event.getSpilledUrl(), event.getSpilledNodeId());
                if (!event.getSpilledUrl().equals(state.getSpilledUrl())) {
                    state.setSpilled(event.getSpilledUrl(), event.getSpilledNodeId());
                    changed = true;
                }
            }
        }

        Iterator<NodeId> it = state.mutableLocations().iterator();
        while (it.hasNext()) {
            NodeId nodeId = it.next();
            if (removedNodeFilter.isRemoved(nodeId)) {
                log.debug("Dropping location {} of object {}: node was removed", nodeId, state.getObjectId());
                it.remove();
            }
        }

        return changed;
    }
}
