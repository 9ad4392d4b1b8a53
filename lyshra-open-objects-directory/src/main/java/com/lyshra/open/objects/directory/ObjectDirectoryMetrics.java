package com.lyshra.open.objects.directory;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters describing the work done by an object directory.
 *
 * Thread Safety: This class is thread-safe.
 */
@Getter
@ToString
public final class ObjectDirectoryMetrics {

    private final LongAdder locationUpdatesProcessed = new LongAdder();
    private final LongAdder locationEventsMerged = new LongAdder();
    private final LongAdder unchangedUpdates = new LongAdder();
    private final LongAdder callbacksInvoked = new LongAdder();
    private final LongAdder nodeRemovalsHandled = new LongAdder();
    private final LongAdder objectsPurgedByNodeRemoval = new LongAdder();
    private final LongAdder subscriptionsAdded = new LongAdder();
    private final LongAdder subscriptionsRemoved = new LongAdder();
    private final Instant startTime = Instant.now();

    public void recordLocationUpdate(int eventCount, boolean changed) {
        locationUpdatesProcessed.increment();
        locationEventsMerged.add(eventCount);
        if (!changed) {
            unchangedUpdates.increment();
        }
    }

    public void recordCallbacks(int count) {
        callbacksInvoked.add(count);
    }

    public void recordNodeRemoval(int affectedObjects) {
        nodeRemovalsHandled.increment();
        objectsPurgedByNodeRemoval.add(affectedObjects);
    }

    public void recordSubscriptionAdded() {
        subscriptionsAdded.increment();
    }

    public void recordSubscriptionsRemoved(int count) {
        subscriptionsRemoved.add(count);
    }

    /**
     * Returns a compact one-line summary.
     */
    public String getSummary() {
        return String.format(
                "ObjectDirectoryMetrics{updates=%d, events=%d, unchanged=%d, callbacks=%d, nodeRemovals=%d, "
                        + "purged=%d, subscribed=%d, unsubscribed=%d}",
                locationUpdatesProcessed.sum(), locationEventsMerged.sum(), unchangedUpdates.sum(),
                callbacksInvoked.sum(), nodeRemovalsHandled.sum(), objectsPurgedByNodeRemoval.sum(),
                subscriptionsAdded.sum(), subscriptionsRemoved.sum());
    }
}
