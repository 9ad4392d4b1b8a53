package com.lyshra.open.objects.directory.location;

import com.lyshra.open.objects.core.exception.LocationConsistencyException;
import com.lyshra.open.objects.core.id.NodeId;
import com.lyshra.open.objects.core.id.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LocationMergeEngine}.
 * Tests location add/remove idempotence, size handling, spill replacement and the membership purge.
 */
class LocationMergeEngineTest {

    private static final IRemovedNodeFilter NONE_REMOVED = nodeId -> false;

    private LocationMergeEngine engine;
    private ObjectLocationState state;
    private NodeId nodeA;
    private NodeId nodeB;

    @BeforeEach
    void setUp() {
        engine = new LocationMergeEngine();
        state = new ObjectLocationState(ObjectId.fromRandom());
        nodeA = NodeId.fromRandom();
        nodeB = NodeId.fromRandom();
    }

    // ========================================================================
    // LOCATION ADD / REMOVE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Location Add/Remove")
    class LocationTests {

        @Test
        @DisplayName("should report change only for the first of two identical adds")
        void shouldBeIdempotentForDuplicateAdds() {
            // When
            boolean first = engine.merge(List.of(LocationChangeEvent.added(nodeA, 100)), state, NONE_REMOVED);
            boolean second = engine.merge(List.of(LocationChangeEvent.added(nodeA, 100)), state, NONE_REMOVED);

            // Then
            assertTrue(first);
            assertFalse(second);
            assertEquals(Set.of(nodeA), state.getLocations());
        }

        @Test
        @DisplayName("should collapse a duplicate add inside one batch")
        void shouldCollapseDuplicateAddInOneBatch() {
            boolean changed = engine.merge(
                    List.of(LocationChangeEvent.added(nodeA, 0), LocationChangeEvent.added(nodeA, 0)),
                    state, NONE_REMOVED);

            assertTrue(changed);
            assertEquals(1, state.getLocations().size());
        }

        @Test
        @DisplayName("should remove a present location")
        void shouldRemovePresentLocation() {
            // Given
            engine.merge(List.of(LocationChangeEvent.added(nodeA, 0), LocationChangeEvent.added(nodeB, 0)),
                    state, NONE_REMOVED);

            // When
            boolean changed = engine.merge(List.of(LocationChangeEvent.removed(nodeA)), state, NONE_REMOVED);

            // Then
            assertTrue(changed);
            assertEquals(Set.of(nodeB), state.getLocations());
        }

        @Test
        @DisplayName("should ignore removal of an absent location")
        void shouldIgnoreRemovalOfAbsentLocation() {
            boolean changed = engine.merge(List.of(LocationChangeEvent.removed(nodeA)), state, NONE_REMOVED);

            assertFalse(changed);
            assertTrue(state.getLocations().isEmpty());
        }

        @Test
        @DisplayName("should apply events in delivery order")
        void shouldApplyEventsInOrder() {
            boolean changed = engine.merge(
                    List.of(LocationChangeEvent.added(nodeA, 0), LocationChangeEvent.removed(nodeA)),
                    state, NONE_REMOVED);

            // Add then remove: the set ends empty but it did change along the way.
            assertTrue(changed);
            assertTrue(state.getLocations().isEmpty());
        }

        @Test
        @DisplayName("should report no change for an empty batch")
        void shouldReportNoChangeForEmptyBatch() {
            assertFalse(engine.merge(List.of(), state, NONE_REMOVED));
        }
    }

    // ========================================================================
    // OBJECT SIZE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Object Size")
    class ObjectSizeTests {

        @Test
        @DisplayName("should keep a known size when a later event carries size 0")
        void shouldKeepKnownSize() {
            engine.merge(List.of(LocationChangeEvent.added(nodeA, 5000)), state, NONE_REMOVED);
            engine.merge(List.of(LocationChangeEvent.added(nodeB, 0)), state, NONE_REMOVED);

            assertEquals(5000, state.getObjectSize());
        }

        @Test
        @DisplayName("should overwrite size with a later nonzero size")
        void shouldOverwriteWithNonzeroSize() {
            engine.merge(List.of(LocationChangeEvent.added(nodeA, 5000)), state, NONE_REMOVED);
            engine.merge(List.of(LocationChangeEvent.added(nodeB, 7000)), state, NONE_REMOVED);

            assertEquals(7000, state.getObjectSize());
        }

        @Test
        @DisplayName("should not count a size-only update as a change")
        void shouldNotCountSizeAsChange() {
            engine.merge(List.of(LocationChangeEvent.added(nodeA, 0)), state, NONE_REMOVED);

            boolean changed = engine.merge(List.of(LocationChangeEvent.added(nodeA, 42)), state, NONE_REMOVED);

            assertFalse(changed);
            assertEquals(42, state.getObjectSize());
        }
    }

    // ========================================================================
    // SPILL TESTS
    // ========================================================================

    @Nested
    @DisplayName("Spill Reports")
    class SpillTests {

        @Test
        @DisplayName("should report change only for the first of two identical spill urls")
        void shouldReplaceSpillUrlOnce() {
            String url = "s3://bucket/object-1";

            boolean first = engine.merge(List.of(LocationChangeEvent.spilled(url, nodeA, 0)), state, NONE_REMOVED);
            boolean second = engine.merge(List.of(LocationChangeEvent.spilled(url, nodeB, 0)), state, NONE_REMOVED);

            assertTrue(first);
            assertFalse(second);
            assertEquals(url, state.getSpilledUrl());
            // A repeated url does not replace the spilled node either.
            assertEquals(nodeA, state.getSpilledNodeId());
        }

        @Test
        @DisplayName("should replace both url and spilled node when the url changes")
        void shouldReplaceOnNewUrl() {
            engine.merge(List.of(LocationChangeEvent.spilled("file:///tmp/a", nodeA, 0)), state, NONE_REMOVED);

            boolean changed = engine.merge(
                    List.of(LocationChangeEvent.spilled("file:///tmp/b", nodeB, 0)), state, NONE_REMOVED);

            assertTrue(changed);
            assertEquals("file:///tmp/b", state.getSpilledUrl());
            assertEquals(nodeB, state.getSpilledNodeId());
        }

        @Test
        @DisplayName("should fail fatally on a spill report without url")
        void shouldFailOnEmptySpillUrl() {
            LocationChangeEvent malformed = LocationChangeEvent.builder().size(10).build();

            LocationConsistencyException e = assertThrows(LocationConsistencyException.class,
                    () -> engine.merge(List.of(malformed), state, NONE_REMOVED));

            assertEquals(state.getObjectId(), e.getObjectId());
        }

        @Test
        @DisplayName("should reject an event with both node id and spill url")
        void shouldRejectMixedEvent() {
            assertThrows(IllegalArgumentException.class, () -> LocationChangeEvent.builder()
                    .nodeId(nodeA)
                    .add(true)
                    .spilledUrl("s3://bucket/x")
                    .build());
        }
    }

    // ========================================================================
    // MEMBERSHIP PURGE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Membership Purge")
    class MembershipPurgeTests {

        @Test
        @DisplayName("should purge removed nodes after merging")
        void shouldPurgeRemovedNodes() {
            // Given
            engine.merge(List.of(LocationChangeEvent.added(nodeA, 0), LocationChangeEvent.added(nodeB, 0)),
                    state, NONE_REMOVED);

            // When
            engine.merge(List.of(), state, nodeId -> nodeId.equals(nodeA));

            // Then
            assertThat(state.getLocations()).containsExactly(nodeB);
        }

        @Test
        @DisplayName("should not report the purge as a change")
        void shouldNotReportPurgeAsChange() {
            engine.merge(List.of(LocationChangeEvent.added(nodeA, 0)), state, NONE_REMOVED);

            boolean changed = engine.merge(List.of(), state, nodeId -> true);

            assertFalse(changed);
            assertTrue(state.getLocations().isEmpty());
        }

        @Test
        @DisplayName("should drop an add for a node that is already removed")
        void shouldDropAddForRemovedNode() {
            boolean changed = engine.merge(List.of(LocationChangeEvent.added(nodeA, 0)), state,
                    nodeId -> nodeId.equals(nodeA));

            // The add counts as a change even though the purge takes it away again.
            assertTrue(changed);
            assertFalse(state.hasLocation(nodeA));
        }
    }
}
