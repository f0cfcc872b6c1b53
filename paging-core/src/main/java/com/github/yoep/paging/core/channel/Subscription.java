package com.github.yoep.paging.core.channel;

/**
 * The active subscription of a consumer on a {@link PagingChannel}.
 */
public interface Subscription {
    /**
     * Release the subscription.
     * Values which are still queued for delivery are dropped.
     */
    void unsubscribe();

    /**
     * Check if this subscription has been released.
     *
     * @return Returns true if released, else false.
     */
    boolean isUnsubscribed();
}
