package com.lyshra.open.objects.directory.config;

import com.lyshra.open.objects.core.id.NodeId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Configuration for the object directory of one node.
 *
 * Encapsulates the local node's identity and address and the tunables of the
 * directory event loop. Uses the Builder pattern for flexible configuration construction.
 */
@Getter
@Builder
@ToString
public final class ObjectDirectoryConfig {

    // Node configuration
    private final NodeId selfNodeId;

    @Builder.Default
    private final String nodeManagerAddress = "127.0.0.1";

    @Builder.Default
    private final int objectManagerPort = 8076;

    // Event loop configuration
    @Builder.Default
    private final String dispatcherThreadName = "object-directory";

    // Subscription configuration
    @Builder.Default
    private final boolean replayStateOnSubscribe = true;

    /**
     * Creates a default configuration for local development.
     */
    public static ObjectDirectoryConfig defaultConfig() {
        return ObjectDirectoryConfig.builder()
                .selfNodeId(NodeId.fromRandom())
                .build();
    }

    /**
     * Creates a configuration for a node reachable at the given address.
     */
    public static ObjectDirectoryConfig forNode(NodeId nodeId, String address, int port) {
        return ObjectDirectoryConfig.builder()
                .selfNodeId(Objects.requireNonNull(nodeId))
                .nodeManagerAddress(Objects.requireNonNull(address))
                .objectManagerPort(port)
                .build();
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (selfNodeId == null || selfNodeId.isNil()) {
            throw new IllegalStateException("selfNodeId must be set");
        }
        if (nodeManagerAddress == null || nodeManagerAddress.isBlank()) {
            throw new IllegalStateException("nodeManagerAddress must not be blank");
        }
        if (objectManagerPort <= 0 || objectManagerPort > 65535) {
            throw new IllegalStateException("objectManagerPort must be between 1 and 65535");
        }
        if (dispatcherThreadName == null || dispatcherThreadName.isBlank()) {
            throw new IllegalStateException("dispatcherThreadName must not be blank");
        }
    }
}
