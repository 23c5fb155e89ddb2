package org.nostrpool.errors;

/**
 * Thrown when an operation names a subscription that is closed or was never opened.
 */
public class SubscriptionClosedException extends RelayPoolException {

    /**
     * Creates a new SubscriptionClosedException.
     *
     * @param subscriptionId the closed or unknown subscription id
     */
    public SubscriptionClosedException(String subscriptionId) {
        super("subscription is closed or unknown: " + subscriptionId);
    }
}
