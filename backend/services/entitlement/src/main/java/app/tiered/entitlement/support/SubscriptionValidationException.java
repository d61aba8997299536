package app.tiered.entitlement.support;

/**
 * The caller asked for something the business rules do not allow. Nothing was written.
 */
public class SubscriptionValidationException extends IllegalArgumentException {

    public SubscriptionValidationException(String message) {
        super(message);
    }

    public SubscriptionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
