package app.tiered.entitlement.subscription;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.PlanPricingEntity;
import app.tiered.entitlement.support.SubscriptionValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Legal status transitions and the time windows (trial, paid, grace) of a subscription.
 * Every method takes the evaluation instant explicitly; nothing here reads the clock.
 * Transition methods mutate the entity in place and throw {@link InvalidSubscriptionStateException}
 * when the move is not allowed.
 */
@Component
public class SubscriptionStateMachine {

    private static final Set<SubscriptionStatus> RENEWABLE = EnumSet.of(
            SubscriptionStatus.ACTIVE, SubscriptionStatus.EXPIRED, SubscriptionStatus.INACTIVE);
    private static final Set<SubscriptionStatus> CANCELABLE = EnumSet.of(
            SubscriptionStatus.ACTIVE, SubscriptionStatus.TRIAL);

    private final EntitlementProps props;

    public SubscriptionStateMachine(EntitlementProps props) {
        this.props = props;
    }

    public boolean isActive(SubscriptionEntity s, Instant now) {
        return s.getStatus().isActiveFamily() && hasValidPeriod(s, now);
    }

    public boolean hasValidPeriod(SubscriptionEntity s, Instant now) {
        Instant endsAt = s.getEndsAt();
        return endsAt == null || !now.isAfter(endsAt) || isInGracePeriod(s, now);
    }

    public boolean isOnTrial(SubscriptionEntity s, Instant now) {
        return s.getStatus() == SubscriptionStatus.TRIAL
                && s.getTrialEndsAt() != null
                && s.getTrialEndsAt().isAfter(now);
    }

    /**
     * True in the window {@code (endsAt, graceEndsAt]}.
     */
    public boolean isInGracePeriod(SubscriptionEntity s, Instant now) {
        Instant grace = s.getGraceEndsAt();
        if (grace == null || now.isAfter(grace)) {
            return false;
        }
        Instant endsAt = s.getEndsAt();
        return endsAt == null || now.isAfter(endsAt);
    }

    public boolean isEndingSoon(SubscriptionEntity s, Instant now, int thresholdDays) {
        Instant endsAt = s.getEndsAt();
        if (endsAt == null || endsAt.isBefore(now)) {
            return false;
        }
        long days = Duration.between(now, endsAt).toDays();
        return days <= thresholdDays;
    }

    public boolean isLifetime(SubscriptionEntity s) {
        return s.getEndsAt() == null;
    }

    public boolean isExpired(SubscriptionEntity s, Instant now) {
        if (s.getStatus() == SubscriptionStatus.EXPIRED) {
            return true;
        }
        return s.getEndsAt() != null && now.isAfter(s.getEndsAt()) && !isInGracePeriod(s, now);
    }

    /**
     * Whole days left in the paid window, rounded up. Empty for lifetime subscriptions.
     */
    public OptionalLong daysRemaining(SubscriptionEntity s, Instant now) {
        return ceilDaysUntil(s.getEndsAt(), now);
    }

    public OptionalLong trialDaysRemaining(SubscriptionEntity s, Instant now) {
        if (s.getTrialEndsAt() == null) {
            return OptionalLong.empty();
        }
        return ceilDaysUntil(s.getTrialEndsAt(), now);
    }

    public boolean shouldAutoRenew(SubscriptionEntity s, Instant now) {
        return s.isAutoRenewal()
                && s.getStatus() == SubscriptionStatus.ACTIVE
                && s.getEndsAt() != null
                && !s.getEndsAt().isAfter(now);
    }

    public boolean canRenew(SubscriptionEntity s) {
        return RENEWABLE.contains(s.getStatus());
    }

    public boolean canCancel(SubscriptionEntity s) {
        return CANCELABLE.contains(s.getStatus());
    }

    public boolean canResume(SubscriptionEntity s, Instant now) {
        return s.getStatus() == SubscriptionStatus.CANCELED && hasValidPeriod(s, now);
    }

    public boolean canExpire(SubscriptionEntity s, Instant now) {
        if (!s.getStatus().canTransitionTo(SubscriptionStatus.EXPIRED)) {
            return false;
        }
        return !isLifetime(s) || isInGracePeriod(s, now);
    }

    /**
     * Moves to ACTIVE. Returns false without touching the entity when it already is ACTIVE.
     */
    public boolean activate(SubscriptionEntity s) {
        if (s.getStatus() == SubscriptionStatus.ACTIVE) {
            return false;
        }
        require(s, SubscriptionStatus.ACTIVE, "activate");
        s.setStatus(SubscriptionStatus.ACTIVE);
        return true;
    }

    public void cancel(SubscriptionEntity s) {
        if (!canCancel(s)) {
            throw new InvalidSubscriptionStateException(s.getSubscriptionId(), s.getStatus(), "cancel");
        }
        s.setStatus(SubscriptionStatus.CANCELED);
        s.setGraceEndsAt(graceEndFor(s.getEndsAt()));
    }

    public void resume(SubscriptionEntity s, Instant now) {
        if (!canResume(s, now)) {
            throw new InvalidSubscriptionStateException(s.getSubscriptionId(), s.getStatus(), "resume");
        }
        s.setStatus(SubscriptionStatus.ACTIVE);
        s.setGraceEndsAt(null);
    }

    /**
     * Extends the paid window by the pricing duration, from the current end when it is still
     * ahead, otherwise from {@code now}. A lifetime pricing clears the end date.
     */
    public void renew(SubscriptionEntity s, PlanPricingEntity pricing, Instant now) {
        if (!canRenew(s)) {
            throw new InvalidSubscriptionStateException(s.getSubscriptionId(), s.getStatus(), "renew");
        }
        if (pricing.isLifetime()) {
            s.setEndsAt(null);
        } else {
            Instant current = s.getEndsAt();
            Instant base = (current != null && current.isAfter(now)) ? current : now;
            s.setEndsAt(base.plus(pricing.getDurationInDays(), ChronoUnit.DAYS));
        }
        s.setGraceEndsAt(graceEndFor(s.getEndsAt()));
        s.setStatus(SubscriptionStatus.ACTIVE);
    }

    /**
     * Marks the subscription EXPIRED and reports whether it was inside its grace window.
     */
    public boolean expire(SubscriptionEntity s, Instant now) {
        if (!canExpire(s, now)) {
            throw new InvalidSubscriptionStateException(s.getSubscriptionId(), s.getStatus(), "expire");
        }
        boolean wasInGrace = isInGracePeriod(s, now);
        s.setStatus(SubscriptionStatus.EXPIRED);
        return wasInGrace;
    }

    /**
     * Retires a subscription replaced by a plan change. No grace window is opened.
     */
    public void supersede(SubscriptionEntity s) {
        require(s, SubscriptionStatus.CANCELED, "supersede");
        s.setStatus(SubscriptionStatus.CANCELED);
        s.setAutoRenewal(false);
    }

    public void deactivate(SubscriptionEntity s) {
        require(s, SubscriptionStatus.INACTIVE, "deactivate");
        s.setStatus(SubscriptionStatus.INACTIVE);
    }

    public Instant graceEndFor(Instant endsAt) {
        if (endsAt == null) {
            return null;
        }
        return endsAt.plus(props.gracePeriodDays(), ChronoUnit.DAYS);
    }

    public void validateState(SubscriptionEntity s) {
        if (s.getStartsAt() == null) {
            throw new SubscriptionValidationException("Subscription start date is required");
        }
        if (s.getEndsAt() != null && s.getStartsAt().isAfter(s.getEndsAt())) {
            throw new SubscriptionValidationException("Subscription starts after it ends");
        }
        if (s.getGraceEndsAt() != null && s.getEndsAt() != null && s.getGraceEndsAt().isBefore(s.getEndsAt())) {
            throw new SubscriptionValidationException("Grace period ends before the subscription ends");
        }
    }

    /**
     * Checks a row that is about to be inserted, including the trial end date.
     */
    public void validateNew(SubscriptionEntity s, Instant now) {
        validateState(s);
        if (s.getStatus() == SubscriptionStatus.TRIAL
                && (s.getTrialEndsAt() == null || !s.getTrialEndsAt().isAfter(now))) {
            throw new SubscriptionValidationException("Trial end date must be in the future");
        }
    }

    private static void require(SubscriptionEntity s, SubscriptionStatus target, String operation) {
        if (!s.getStatus().canTransitionTo(target)) {
            throw new InvalidSubscriptionStateException(s.getSubscriptionId(), s.getStatus(), operation);
        }
    }

    private static OptionalLong ceilDaysUntil(Instant end, Instant now) {
        if (end == null) {
            return OptionalLong.empty();
        }
        if (!end.isAfter(now)) {
            return OptionalLong.of(0);
        }
        long seconds = Duration.between(now, end).getSeconds();
        return OptionalLong.of((seconds + 86_399) / 86_400);
    }
}
