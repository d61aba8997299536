package app.tiered.entitlement.subscriber;

import java.util.Objects;

/**
 * Polymorphic pointer to whatever owns a subscription: an owner type tag plus the owner's id.
 */
public record SubscriberRef(String type, String id) {

    public SubscriberRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        if (type.isBlank() || id.isBlank()) {
            throw new IllegalArgumentException("Subscriber type and id must not be blank");
        }
    }

    public static SubscriberRef of(Subscribable subscriber) {
        return new SubscriberRef(subscriber.subscriberType(), subscriber.subscriberId());
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
