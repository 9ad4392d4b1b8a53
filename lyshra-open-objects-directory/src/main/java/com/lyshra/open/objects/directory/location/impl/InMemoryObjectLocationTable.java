package com.lyshra.open.objects.directory.location.impl;

import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import com.lyshra.open.objects.directory.location.IObjectLocationTable;
import com.lyshra.open.objects.directory.location.LocationChangeEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of IObjectLocationTable for testing and single-node deployments.
 *
 * Features:
 * - Per-object location records with spill and size information
 * - Per-object subscriptions that start with a snapshot batch and then follow every change
 *
 * Limitations:
 * - Not distributed (only works for single JVM)
 * - State is lost on restart
 *
 * Thread Safety: All mutations and subscription handshakes are serialized on one
 * monitor, so a subscriber never misses or double-counts a change between its
 * snapshot and the live stream.
 */
@Slf4j
public class InMemoryObjectLocationTable implements IObjectLocationTable {

    private final Object lock = new Object();
    private final Map<ObjectId, LocationRecord> records = new HashMap<>();
    private final Map<ObjectId, List<FluxSink<List<LocationChangeEvent>>>> subscribers = new HashMap<>();

    @Override
    public Mono<Void> addLocation(ObjectId objectId, NodeId nodeId, long objectSize) {
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                LocationRecord record = records.computeIfAbsent(objectId, id -> new LocationRecord());
                record.locations.add(nodeId);
                record.updateSize(objectSize);
                log.debug("Object {} added at node {} (size: {})", objectId, nodeId, objectSize);
                publish(objectId, List.of(LocationChangeEvent.added(nodeId, objectSize)));
            }
        });
    }

    @Override
    public Mono<Void> removeLocation(ObjectId objectId, NodeId nodeId) {
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                LocationRecord record = records.get(objectId);
                if (record != null) {
                    record.locations.remove(nodeId);
                }
                log.debug("Object {} removed from node {}", objectId, nodeId);
                publish(objectId, List.of(LocationChangeEvent.removed(nodeId)));
            }
        });
    }

    @Override
    public Mono<Void> reportSpilled(ObjectId objectId, String spilledUrl, NodeId spilledNodeId, long objectSize) {
        Objects.requireNonNull(objectId, "objectId must not be null");
        if (spilledUrl == null || spilledUrl.isEmpty()) {
            return Mono.error(new IllegalArgumentException("spilledUrl must not be empty"));
        }

        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                LocationRecord record = records.computeIfAbsent(objectId, id -> new LocationRecord());
                record.spilledUrl = spilledUrl;
                record.spilledNodeId = spilledNodeId != null ? spilledNodeId : NodeId.nil();
                record.updateSize(objectSize);
                log.debug("Object {} spilled at {} by node {}", objectId, spilledUrl, spilledNodeId);
                publish(objectId, List.of(LocationChangeEvent.spilled(spilledUrl, spilledNodeId, objectSize)));
            }
        });
    }

    @Override
    public Flux<List<LocationChangeEvent>> subscribe(ObjectId objectId) {
        Objects.requireNonNull(objectId, "objectId must not be null");

        return Flux.create(sink -> {
            sink.onDispose(() -> {
                synchronized (lock) {
                    List<FluxSink<List<LocationChangeEvent>>> sinks = subscribers.get(objectId);
                    if (sinks != null) {
                        sinks.remove(sink);
                        if (sinks.isEmpty()) {
                            subscribers.remove(objectId);
                        }
                    }
                }
            });
            synchronized (lock) {
                subscribers.computeIfAbsent(objectId, id -> new CopyOnWriteArrayList<>()).add(sink);
                LocationRecord record = records.get(objectId);
                sink.next(record != null ? record.toEvents() : List.of());
            }
        });
    }

    /**
     * Returns the number of live subscriptions for an object.
     */
    public int getSubscriberCount(ObjectId objectId) {
        synchronized (lock) {
            List<FluxSink<List<LocationChangeEvent>>> sinks = subscribers.get(objectId);
            return sinks != null ? sinks.size() : 0;
        }
    }

    private void publish(ObjectId objectId, List<LocationChangeEvent> batch) {
        List<FluxSink<List<LocationChangeEvent>>> sinks = subscribers.get(objectId);
        if (sinks == null) {
            return;
        }
        for (FluxSink<List<LocationChangeEvent>> sink : sinks) {
            sink.next(batch);
        }
    }

    private static final class LocationRecord {
        private final Set<NodeId> locations = new LinkedHashSet<>();
        private String spilledUrl = "";
        private NodeId spilledNodeId = NodeId.nil();
        private long objectSize;

        private void updateSize(long size) {
            if (size > 0) {
                objectSize = size;
            }
        }

        private List<LocationChangeEvent> toEvents() {
            List<LocationChangeEvent> events = new ArrayList<>();
            for (NodeId nodeId : locations) {
                events.add(LocationChangeEvent.added(nodeId, objectSize));
            }
            if (!spilledUrl.isEmpty()) {
                events.add(LocationChangeEvent.spilled(spilledUrl, spilledNodeId, objectSize));
            }
            return events;
        }
    }
}
