package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscription.event.SubscriptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
public class SubscriptionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionEventPublisher.class);

    private final ApplicationEventPublisher publisher;

    public SubscriptionEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(SubscriptionEvent event) {
        log.debug("Queue event {}: subscriptionId={}", event.getClass().getSimpleName(), event.subscription().subscriptionId());
        publisher.publishEvent(event);
    }
}
