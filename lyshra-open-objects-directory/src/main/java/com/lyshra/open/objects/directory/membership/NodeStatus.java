package com.lyshra.open.objects.directory.membership;

/**
 * Represents the status of a node as recorded in the membership table.
 *
 * <pre>
 * ALIVE -> DEAD
 * </pre>
 *
 * DEAD is terminal: a removed node id never rejoins the cluster. A restarted
 * process registers under a fresh node id.
 */
public enum NodeStatus {

    /**
     * Node is a live member of the cluster.
     */
    ALIVE("Node is alive"),

    /**
     * Node has been removed from the cluster (left or confirmed failed).
     */
    DEAD("Node has been removed");

    private final String description;

    NodeStatus(String description) {
        this.description = description;
    }

    /**
     * Gets a human-readable description of this status.
     *
     * @return the status description
     */
    public String getDescription() {
        return description;
    }

    /**
     * Checks if this is a terminal status.
     *
     * @return true if terminal
     */
    public boolean isTerminal() {
        return this == DEAD;
    }

    /**
     * Checks if transition to the target status is valid.
     *
     * @param target the target status
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(NodeStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case ALIVE -> target == DEAD;
            case DEAD -> false;
        };
    }
}
