package app.tiered.entitlement.subscriber;

import java.util.Optional;

/**
 * Implemented by the host application, one bean per subscriber type.
 */
public interface SubscriberResolver {

    String type();

    Optional<? extends Subscribable> resolve(String id);
}
