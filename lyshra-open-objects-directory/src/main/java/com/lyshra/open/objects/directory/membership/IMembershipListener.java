package com.lyshra.open.objects.directory.membership;

/**
 * Listener interface for membership table changes.
 *
 * Design Pattern: Observer Pattern - decouples event producers from consumers.
 */
@FunctionalInterface
public interface IMembershipListener {

    /**
     * Called after the membership table has recorded a change.
     *
     * @param event the membership change event
     */
    void onMembershipChange(MembershipEvent event);
}
