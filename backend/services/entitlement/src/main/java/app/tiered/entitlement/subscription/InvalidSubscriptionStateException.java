package app.tiered.entitlement.subscription;

import java.util.UUID;

public class InvalidSubscriptionStateException extends IllegalStateException {

    private final UUID subscriptionId;
    private final SubscriptionStatus status;
    private final String operation;

    public InvalidSubscriptionStateException(UUID subscriptionId, SubscriptionStatus status, String operation) {
        super("Cannot " + operation + " subscription " + subscriptionId + " in status " + status);
        this.subscriptionId = subscriptionId;
        this.status = status;
        this.operation = operation;
    }

    public UUID getSubscriptionId() {
        return subscriptionId;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public String getOperation() {
        return operation;
    }
}
