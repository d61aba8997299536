package app.tiered.entitlement.subscriber;

/**
 * Capability a host entity exposes to be able to hold subscriptions.
 */
public interface Subscribable {

    String subscriberType();

    String subscriberId();

    default SubscriberRef subscriberRef() {
        return SubscriberRef.of(this);
    }
}
