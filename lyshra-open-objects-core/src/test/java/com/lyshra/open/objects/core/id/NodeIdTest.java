package com.lyshra.open.objects.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link NodeId} and the shared {@link BaseId} behaviour.
 */
class NodeIdTest {

    @Test
    @DisplayName("should treat empty binary as the nil id")
    void shouldTreatEmptyBinaryAsNil() {
        NodeId id = NodeId.fromBinary(new byte[0]);

        assertTrue(id.isNil());
        assertEquals(NodeId.nil(), id);
    }

    @Test
    @DisplayName("should reject binary of the wrong length")
    void shouldRejectWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> NodeId.fromBinary(new byte[5]));
    }

    @Test
    @DisplayName("should compare ids by value")
    void shouldCompareByValue() {
        NodeId id = NodeId.fromRandom();
        NodeId copy = NodeId.fromBinary(id.toBinary());

        assertEquals(id, copy);
        assertEquals(id.hashCode(), copy.hashCode());
        assertFalse(id.isNil());
    }

    @Test
    @DisplayName("should round trip through hex")
    void shouldRoundTripThroughHex() {
        NodeId id = NodeId.fromRandom();

        assertEquals(id, NodeId.fromHex(id.toHex()));
        assertEquals(NodeId.SIZE * 2, id.toHex().length());
    }

    @Test
    @DisplayName("should not expose internal bytes")
    void shouldNotExposeInternalBytes() {
        NodeId id = NodeId.fromRandom();
        byte[] bytes = id.toBinary();
        bytes[0] = (byte) (bytes[0] + 1);

        assertNotEquals(id, NodeId.fromBinary(bytes));
    }

    @Test
    @DisplayName("should not equal an object id with the same bytes")
    void shouldNotEqualObjectIdWithSameBytes() {
        NodeId nodeId = NodeId.fromRandom();
        ObjectId objectId = ObjectId.fromBinary(nodeId.toBinary());

        assertNotEquals(nodeId, objectId);
    }
}
