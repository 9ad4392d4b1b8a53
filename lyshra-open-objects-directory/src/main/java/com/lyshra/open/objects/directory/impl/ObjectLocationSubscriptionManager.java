package com.lyshra.open.objects.directory.impl;

import com.lyshra.open.objects.core.exception.LocationConsistencyException;
import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import com.lyshra.open.objects.directory.IObjectDirectory;
import com.lyshra.open.objects.directory.IObjectLocationCallback;
import com.lyshra.open.objects.directory.location.IObjectLocationTable;
import com.lyshra.open.objects.directory.location.LocationChangeEvent;
import com.lyshra.open.objects.directory.membership.IMembershipTable;
import com.lyshra.open.objects.directory.membership.MembershipEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.concurrent.Queues;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Connects an object directory to the metadata store and to cluster membership.
 *
 * Responsibilities:
 * - Opens a location-table subscription when an object gets its first subscriber
 *   and closes it after the last one leaves
 * - Forwards NODE_REMOVED membership events to {@link IObjectDirectory#handleNodeRemoved(NodeId)}
 * - Forwards local add/remove/spill reports to the location table
 *
 * Every directory call is made on one single-threaded scheduler, which acts as
 * the directory's cooperative event loop: a location batch or node removal is
 * processed to completion before the next one starts.
 *
 * Error policy: an exception thrown by a subscriber callback is logged and the
 * feed stays open. A {@link LocationConsistencyException} is fatal: it terminates
 * the feed it came from, evicts the object from the directory and is published
 * on {@link #consistencyFailures()}.
 */
@Slf4j
public class ObjectLocationSubscriptionManager {

    private final IObjectDirectory directory;
    private final IObjectLocationTable locationTable;
    private final IMembershipTable membershipTable;
    private final Scheduler scheduler;

    private final Map<ObjectId, Disposable.Swap> locationSubscriptions = new ConcurrentHashMap<>();
    private final Disposable.Swap membershipSubscription = Disposables.swap();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Sinks.Many<LocationConsistencyException> consistencyFailureSink =
            Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);

    public ObjectLocationSubscriptionManager(IObjectDirectory directory,
                                             IObjectLocationTable locationTable,
                                             IMembershipTable membershipTable,
                                             Scheduler scheduler) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.locationTable = Objects.requireNonNull(locationTable, "locationTable must not be null");
        this.membershipTable = Objects.requireNonNull(membershipTable, "membershipTable must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    // ========== Lifecycle ==========

    /**
     * Starts following membership changes and reopens the location feed of every
     * object the directory still tracks.
     *
     * @return Mono that completes once the feeds are attached
     */
    public Mono<Void> start() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.warn("Object location subscription manager already started");
                return Mono.empty();
            }
            membershipSubscription.update(membershipTable.membershipEvents()
                    .filter(MembershipEvent::isRemoval)
                    .publishOn(scheduler)
                    .subscribe(
                            event -> dispatch("removal of node " + event.nodeId(),
                                    () -> directory.handleNodeRemoved(event.nodeId())),
                            error -> log.error("Membership feed terminated", error)));
            return onDirectory(this::reopenLocationFeeds)
                    .doOnSuccess(reopened -> log.info(
                            "Object location subscription manager started ({} location feeds reopened)", reopened))
                    .then();
        });
    }

    /**
     * Detaches from membership and closes every location-table subscription.
     * Directory subscriptions are kept; {@link #start()} reopens their feeds.
     *
     * @return Mono that completes once everything is disposed
     */
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (!running.compareAndSet(true, false)) {
                log.warn("Object location subscription manager is not running");
                return;
            }
            membershipSubscription.update(Disposables.disposed());
            locationSubscriptions.values().forEach(Disposable::dispose);
            locationSubscriptions.clear();
            log.info("Object location subscription manager stopped");
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========== Subscriptions ==========

    /**
     * Subscribes a callback to an object's locations, opening the location-table
     * feed for the object if this is its first subscriber.
     *
     * @return Mono emitting true if the callback was registered
     */
    public Mono<Boolean> subscribe(String callbackId, ObjectId objectId, IObjectLocationCallback callback) {
        return onDirectory(dir -> {
            boolean added = dir.subscribeObjectLocations(callbackId, objectId, callback);
            if (added && !locationSubscriptions.containsKey(objectId)) {
                openLocationFeed(objectId);
            }
            return added;
        });
    }

    /**
     * Unsubscribes a callback, closing the object's location-table feed once no
     * subscriber is left.
     *
     * @return Mono emitting true if a callback was removed
     */
    public Mono<Boolean> unsubscribe(String callbackId, ObjectId objectId) {
        return onDirectory(dir -> {
            boolean removed = dir.unsubscribeObjectLocations(callbackId, objectId);
            if (removed && !dir.isTracked(objectId)) {
                closeLocationFeed(objectId);
            }
            return removed;
        });
    }

    /**
     * Runs a function against the directory on the directory thread.
     *
     * @param action the function to run
     * @return Mono emitting the function's result
     */
    public <T> Mono<T> onDirectory(Function<IObjectDirectory, T> action) {
        Objects.requireNonNull(action, "action must not be null");
        return Mono.fromCallable(() -> action.apply(directory)).subscribeOn(scheduler);
    }

    /**
     * Hot stream of fatal consistency errors. The object whose feed raised the
     * error has already been evicted from the directory when it is emitted.
     *
     * @return Flux of consistency errors
     */
    public Flux<LocationConsistencyException> consistencyFailures() {
        return consistencyFailureSink.asFlux();
    }

    public int getOpenFeedCount() {
        return locationSubscriptions.size();
    }

    // ========== Reports ==========

    public Mono<Void> reportObjectAdded(ObjectId objectId, NodeId nodeId, long objectSize) {
        return locationTable.addLocation(objectId, nodeId, objectSize);
    }

    public Mono<Void> reportObjectRemoved(ObjectId objectId, NodeId nodeId) {
        return locationTable.removeLocation(objectId, nodeId);
    }

    public Mono<Void> reportObjectSpilled(ObjectId objectId, String spilledUrl, NodeId spilledNodeId, long objectSize) {
        return locationTable.reportSpilled(objectId, spilledUrl, spilledNodeId, objectSize);
    }

    private void openLocationFeed(ObjectId objectId) {
        Disposable.Swap feed = Disposables.swap();
        locationSubscriptions.put(objectId, feed);
        feed.update(locationTable.subscribe(objectId)
                .publishOn(scheduler)
                .subscribe(
                        batch -> deliver(objectId, feed, batch),
                        error -> onFeedFailed(objectId, feed, error)));
        log.info("Opened location feed for object {}", objectId);
    }

    private int reopenLocationFeeds(IObjectDirectory dir) {
        int reopened = 0;
        for (ObjectId objectId : dir.getTrackedObjectIds()) {
            if (!locationSubscriptions.containsKey(objectId)) {
                openLocationFeed(objectId);
                reopened++;
            }
        }
        return reopened;
    }

    private void onFeedFailed(ObjectId objectId, Disposable.Swap feed, Throwable error) {
        if (!locationSubscriptions.remove(objectId, feed)) {
            return;
        }
        // The batch may have been applied in part, so the merged state is dropped.
        int dropped = directory.evictObject(objectId);
        log.error("Location feed of object {} terminated, evicted {} subscribers", objectId, dropped, error);

        if (error instanceof LocationConsistencyException) {
            Sinks.EmitResult result = consistencyFailureSink.tryEmitNext((LocationConsistencyException) error);
            if (result.isFailure()) {
                log.warn("Failed to publish consistency failure of object {} ({})", objectId, result);
            }
        }
    }

    private void closeLocationFeed(ObjectId objectId) {
        Disposable.Swap feed = locationSubscriptions.remove(objectId);
        if (feed != null) {
            feed.dispose();
            log.info("Closed location feed for object {}", objectId);
        }
    }

    private void deliver(ObjectId objectId, Disposable.Swap feed, List<LocationChangeEvent> batch) {
        // A batch queued before the feed was closed must not resurrect the object.
        if (locationSubscriptions.get(objectId) != feed) {
            log.debug("Dropping stale location batch for object {}", objectId);
            return;
        }
        dispatch("location update of object " + objectId,
                () -> directory.processLocationUpdate(objectId, batch));
    }

    private void dispatch(String description, Runnable action) {
        try {
            action.run();
        } catch (LocationConsistencyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Subscriber callback failed during {}", description, e);
        }
    }
}
