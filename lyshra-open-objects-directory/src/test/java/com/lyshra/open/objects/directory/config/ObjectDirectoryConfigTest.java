package com.lyshra.open.objects.directory.config;

import com.lyshra.open.objects.core.id.NodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ObjectDirectoryConfigTest {

    @Test
    @DisplayName("should apply defaults")
    void shouldApplyDefaults() {
        ObjectDirectoryConfig config = ObjectDirectoryConfig.defaultConfig();

        assertFalse(config.getSelfNodeId().isNil());
        assertEquals("127.0.0.1", config.getNodeManagerAddress());
        assertEquals(8076, config.getObjectManagerPort());
        assertEquals("object-directory", config.getDispatcherThreadName());
        assertTrue(config.isReplayStateOnSubscribe());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("should reject a nil node id")
    void shouldRejectNilNodeId() {
        ObjectDirectoryConfig config = ObjectDirectoryConfig.builder().selfNodeId(NodeId.nil()).build();

        assertThrows(IllegalStateException.class, config::validate);
    }

    @Test
    @DisplayName("should reject an out of range port")
    void shouldRejectInvalidPort() {
        ObjectDirectoryConfig config = ObjectDirectoryConfig.forNode(NodeId.fromRandom(), "10.0.0.5", 70000);

        assertThrows(IllegalStateException.class, config::validate);
    }

    @Test
    @DisplayName("should reject a blank address")
    void shouldRejectBlankAddress() {
        ObjectDirectoryConfig config = ObjectDirectoryConfig.forNode(NodeId.fromRandom(), " ", 8076);

        assertThrows(IllegalStateException.class, config::validate);
    }
}
