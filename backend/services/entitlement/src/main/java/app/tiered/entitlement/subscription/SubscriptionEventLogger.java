package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscription.event.SubscriptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class SubscriptionEventLogger {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionEventLogger.class);

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEvent(SubscriptionEvent event) {
        SubscriptionSnapshot s = event.subscription();
        log.info(
                "Subscription event {}: subscriptionId={}, subscriber={}, planId={}, status={}",
                event.getClass().getSimpleName(),
                s.subscriptionId(),
                event.subscriber(),
                s.planId(),
                s.status()
        );
    }
}
