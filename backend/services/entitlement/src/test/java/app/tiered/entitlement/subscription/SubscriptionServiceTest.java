package app.tiered.entitlement.subscription;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.PlanCatalog;
import app.tiered.entitlement.plan.PlanEntity;
import app.tiered.entitlement.plan.PlanFeatureEntity;
import app.tiered.entitlement.plan.PlanPricingEntity;
import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscriber.SubscriberRegistry;
import app.tiered.entitlement.subscription.event.FeatureUsageReset;
import app.tiered.entitlement.subscription.event.FeatureUsed;
import app.tiered.entitlement.subscription.event.SubscriptionCanceled;
import app.tiered.entitlement.subscription.event.SubscriptionChanged;
import app.tiered.entitlement.subscription.event.SubscriptionCreated;
import app.tiered.entitlement.subscription.event.SubscriptionEvent;
import app.tiered.entitlement.subscription.event.SubscriptionExpired;
import app.tiered.entitlement.subscription.event.SubscriptionRenewed;
import app.tiered.entitlement.subscription.event.SubscriptionStarted;
import app.tiered.entitlement.subscription.event.TrialStarted;
import app.tiered.entitlement.support.SubscriptionValidationException;
import app.tiered.entitlement.usage.UsageMeteringService;
import app.tiered.entitlement.value.FlexibleValueCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    static final SubscriberRef USER = new SubscriberRef("user", "u-1");

    @Mock
    SubscriptionRepository subscriptionRepository;

    @Mock
    PlanCatalog planCatalog;

    @Mock
    UsageMeteringService metering;

    @Mock
    SubscriptionEventPublisher events;

    @Mock
    SubscriberRegistry subscriberRegistry;

    @Mock
    BillingHook billingHook;

    SubscriptionService service;

    @BeforeEach
    void setup() {
        EntitlementProps props = EntitlementProps.defaults();
        SubscriptionStateMachine stateMachine = new SubscriptionStateMachine(props);
        SubscriptionValidator validator = new SubscriptionValidator(
                subscriptionRepository, planCatalog, new FlexibleValueCodec(new ObjectMapper()), props);
        service = new SubscriptionService(
                subscriptionRepository,
                planCatalog,
                stateMachine,
                metering,
                validator,
                events,
                subscriberRegistry,
                List.of(billingHook),
                props,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void subscribe_createsActiveSubscriptionWithGraceAfterEnd() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.getPricingForPlan(plan.getPlanId(), pricing.getPlanPricingId())).thenReturn(pricing);
        stubInsert();

        SubscriptionSnapshot snapshot = service.subscribe(USER, plan.getPlanId(), pricing.getPlanPricingId());

        assertThat(snapshot.status()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(snapshot.startsAt()).isEqualTo(NOW);
        assertThat(snapshot.endsAt()).isEqualTo(NOW.plus(30, ChronoUnit.DAYS));
        assertThat(snapshot.graceEndsAt()).isEqualTo(NOW.plus(33, ChronoUnit.DAYS));
        assertThat(snapshot.trialEndsAt()).isNull();
        assertThat(snapshot.autoRenewal()).isTrue();

        SubscriptionEvent event = singleEvent();
        assertThat(event).isInstanceOf(SubscriptionStarted.class);
        assertThat(((SubscriptionStarted) event).resumed()).isFalse();
        assertThat(event.subscriber()).isEqualTo(USER);
    }

    @Test
    void subscribe_withTrialStartsInTrial() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.getPricingForPlan(plan.getPlanId(), pricing.getPlanPricingId())).thenReturn(pricing);
        stubInsert();

        SubscriptionSnapshot snapshot = service.subscribe(USER, plan.getPlanId(), pricing.getPlanPricingId(), 7);

        assertThat(snapshot.status()).isEqualTo(SubscriptionStatus.TRIAL);
        assertThat(snapshot.trialEndsAt()).isEqualTo(NOW.plus(7, ChronoUnit.DAYS));
        SubscriptionEvent event = singleEvent();
        assertThat(event).isInstanceOf(TrialStarted.class);
        assertThat(((TrialStarted) event).trialDays()).isEqualTo(7);
    }

    @Test
    void subscribe_lifetimePricingHasNoEndOrGrace() {
        PlanEntity plan = plan("forever");
        PlanPricingEntity pricing = pricing(plan, null, "199.00");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.getPricingForPlan(plan.getPlanId(), pricing.getPlanPricingId())).thenReturn(pricing);
        stubInsert();

        SubscriptionSnapshot snapshot = service.subscribe(USER, plan.getPlanId(), pricing.getPlanPricingId());

        assertThat(snapshot.isLifetime()).isTrue();
        assertThat(snapshot.graceEndsAt()).isNull();
    }

    @Test
    void subscribe_rejectsSecondActiveSubscription() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.getPricingForPlan(plan.getPlanId(), pricing.getPlanPricingId())).thenReturn(pricing);
        when(subscriptionRepository.findForSubscriberForUpdate("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY))
                .thenReturn(List.of(subscription(plan, pricing, SubscriptionStatus.ACTIVE, NOW.plus(10, ChronoUnit.DAYS))));

        assertThatThrownBy(() -> service.subscribe(USER, plan.getPlanId(), pricing.getPlanPricingId()))
                .isInstanceOf(SubscriptionValidationException.class)
                .hasMessageContaining("already has an active subscription");
        verify(subscriptionRepository, never()).saveAndFlush(any());
        verifyNoInteractions(events);
    }

    @Test
    void subscribe_translatesConcurrentInsertIntoValidationError() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.getPricingForPlan(plan.getPlanId(), pricing.getPlanPricingId())).thenReturn(pricing);
        when(subscriptionRepository.saveAndFlush(any(SubscriptionEntity.class)))
                .thenThrow(new DataIntegrityViolationException("ux_subscriptions_single_active"));

        assertThatThrownBy(() -> service.subscribe(USER, plan.getPlanId(), pricing.getPlanPricingId()))
                .isInstanceOf(SubscriptionValidationException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(events);
    }

    @Test
    void subscribe_rejectsTrialOutsideConfiguredBounds() {
        assertThatThrownBy(() -> service.subscribe(USER, UUID.randomUUID(), UUID.randomUUID(), 90))
                .isInstanceOf(SubscriptionValidationException.class);
        assertThatThrownBy(() -> service.subscribe(USER, UUID.randomUUID(), UUID.randomUUID(), -1))
                .isInstanceOf(SubscriptionValidationException.class);
        verifyNoInteractions(planCatalog, subscriptionRepository);
    }

    @Test
    void startTrial_rejectsRepeatedTrialOnSamePlan() {
        PlanEntity plan = plan("basic");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(subscriptionRepository.existsTrialForPlan("user", "u-1", plan.getPlanId())).thenReturn(true);

        assertThatThrownBy(() -> service.startTrial(USER, plan.getPlanId(), 14))
                .isInstanceOf(SubscriptionValidationException.class)
                .hasMessageContaining("trial");
    }

    @Test
    void startTrial_usesCheapestPricing() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity cheapest = pricing(plan, 30, "5.00");
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.trialPricing(plan.getPlanId())).thenReturn(cheapest);
        stubInsert();

        SubscriptionSnapshot snapshot = service.startTrial(USER, plan.getPlanId(), 14);

        assertThat(snapshot.planPricingId()).isEqualTo(cheapest.getPlanPricingId());
        assertThat(snapshot.status()).isEqualTo(SubscriptionStatus.TRIAL);
        assertThat(singleEvent()).isInstanceOf(TrialStarted.class);
    }

    @Test
    void changePlan_downgradeResetsUsageAndCancelsOldSubscription() {
        PlanEntity planA = plan("plan-a");
        PlanPricingEntity monthlyA = pricing(planA, 30, "10.00");
        PlanEntity planB = plan("plan-b");
        PlanPricingEntity monthlyB = pricing(planB, 30, "5.00");
        SubscriptionEntity current = subscription(planA, monthlyA, SubscriptionStatus.ACTIVE, NOW.plus(20, ChronoUnit.DAYS));

        when(subscriptionRepository.findForSubscriberForUpdate("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY))
                .thenReturn(List.of(current));
        when(planCatalog.getAvailablePlan(planB.getPlanId())).thenReturn(planB);
        when(planCatalog.getPricingForPlan(planB.getPlanId(), monthlyB.getPlanPricingId())).thenReturn(monthlyB);
        when(planCatalog.getPricing(monthlyA.getPlanPricingId())).thenReturn(monthlyA);
        when(metering.currentUsage(current, NOW)).thenReturn(Map.of("api_calls", 50L));
        stubInsert();

        SubscriptionSnapshot replacement = service.changePlan(USER, planB.getPlanId(), monthlyB.getPlanPricingId());

        assertThat(replacement.subscriptionId()).isNotEqualTo(current.getSubscriptionId());
        assertThat(replacement.status()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(replacement.planId()).isEqualTo(planB.getPlanId());
        assertThat(replacement.endsAt()).isEqualTo(NOW.plus(30, ChronoUnit.DAYS));
        assertThat(current.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        assertThat(current.isAutoRenewal()).isFalse();
        verify(metering).copyUsages(eq(current), any(SubscriptionEntity.class), eq(true));

        SubscriptionChanged event = (SubscriptionChanged) singleEvent();
        assertThat(event.summary().changeType()).isEqualTo(PlanChangeSummary.ChangeType.DOWNGRADE);
        assertThat(event.summary().usageReset()).isTrue();
        assertThat(event.summary().currency()).isEqualTo("USD");
        assertThat(event.summary().prorationAmount()).isEqualByComparingTo("-3.33");
        assertThat(event.previous().status()).isEqualTo(SubscriptionStatus.CANCELED);
        assertThat(event.isDowngrade()).isTrue();
    }

    @Test
    void changePlan_upgradeCarriesUsageForward() {
        PlanEntity planA = plan("plan-a");
        PlanPricingEntity monthlyA = pricing(planA, 30, "10.00");
        PlanEntity planB = plan("plan-b");
        PlanPricingEntity monthlyB = pricing(planB, 30, "20.00");
        SubscriptionEntity current = subscription(planA, monthlyA, SubscriptionStatus.ACTIVE, NOW.plus(15, ChronoUnit.DAYS));

        when(subscriptionRepository.findForSubscriberForUpdate("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY))
                .thenReturn(List.of(current));
        when(planCatalog.getAvailablePlan(planB.getPlanId())).thenReturn(planB);
        when(planCatalog.getPricingForPlan(planB.getPlanId(), monthlyB.getPlanPricingId())).thenReturn(monthlyB);
        when(planCatalog.getPricing(monthlyA.getPlanPricingId())).thenReturn(monthlyA);
        stubInsert();

        service.changePlan(USER, planB.getPlanId(), monthlyB.getPlanPricingId());

        verify(metering).copyUsages(eq(current), any(SubscriptionEntity.class), eq(false));
        SubscriptionChanged event = (SubscriptionChanged) singleEvent();
        assertThat(event.isUpgrade()).isTrue();
        assertThat(event.summary().usageReset()).isFalse();
        assertThat(event.summary().prorationAmount()).isEqualByComparingTo("5.00");
    }

    @Test
    void changePlan_checksCarriedUsageAsSeenAfterLazyReset() {
        PlanEntity planA = plan("plan-a");
        PlanPricingEntity monthlyA = pricing(planA, 30, "10.00");
        PlanEntity planB = plan("plan-b");
        PlanPricingEntity monthlyB = pricing(planB, 30, "20.00");
        SubscriptionEntity current = subscription(planA, monthlyA, SubscriptionStatus.ACTIVE, NOW.plus(15, ChronoUnit.DAYS));
        PlanFeatureEntity exports = new PlanFeatureEntity();
        exports.setPlanId(planB.getPlanId());
        exports.setFeatureKey("exports");
        exports.setFeatureValue(new FlexibleValueCodec(new ObjectMapper()).encode((Object) 5));

        when(subscriptionRepository.findForSubscriberForUpdate("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY))
                .thenReturn(List.of(current));
        when(planCatalog.getAvailablePlan(planB.getPlanId())).thenReturn(planB);
        when(planCatalog.getPricingForPlan(planB.getPlanId(), monthlyB.getPlanPricingId())).thenReturn(monthlyB);
        when(planCatalog.getPricing(monthlyA.getPlanPricingId())).thenReturn(monthlyA);
        when(planCatalog.findFeature(planB.getPlanId(), "exports")).thenReturn(Optional.of(exports));
        when(metering.currentUsage(current, NOW)).thenReturn(Map.of("exports", 8L), Map.of("exports", 0L));
        stubInsert();

        assertThatThrownBy(() -> service.changePlan(USER, planB.getPlanId(), monthlyB.getPlanPricingId()))
                .isInstanceOf(SubscriptionValidationException.class)
                .hasMessageContaining("exports");
        assertThat(current.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);

        SubscriptionSnapshot replacement = service.changePlan(USER, planB.getPlanId(), monthlyB.getPlanPricingId());

        assertThat(replacement.planId()).isEqualTo(planB.getPlanId());
        assertThat(current.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
    }

    @Test
    void changePlan_withoutActiveSubscriptionFails() {
        assertThatThrownBy(() -> service.changePlan(USER, UUID.randomUUID(), UUID.randomUUID()))
                .isInstanceOf(SubscriptionValidationException.class);
        verifyNoInteractions(events);
    }

    @Test
    void activate_alreadyActiveIsNoop() {
        PlanEntity plan = plan("basic");
        Instant endsAt = NOW.plus(10, ChronoUnit.DAYS);
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, endsAt);
        s.setGraceEndsAt(endsAt.plus(3, ChronoUnit.DAYS));
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.activate(s.getSubscriptionId())).isTrue();
        assertThat(s.getEndsAt()).isEqualTo(endsAt);
        assertThat(s.getGraceEndsAt()).isEqualTo(endsAt.plus(3, ChronoUnit.DAYS));
        verify(subscriptionRepository, never()).saveAndFlush(any());
        verifyNoInteractions(events);
    }

    @Test
    void cancel_opensGraceAndPublishes() {
        PlanEntity plan = plan("basic");
        Instant endsAt = NOW.plus(10, ChronoUnit.DAYS);
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, endsAt);
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.cancel(s.getSubscriptionId())).isTrue();

        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        SubscriptionCanceled event = (SubscriptionCanceled) singleEvent();
        assertThat(event.graceEndsAt()).isEqualTo(endsAt.plus(3, ChronoUnit.DAYS));
    }

    @Test
    void cancel_returnsFalseWhenNotCancelable() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.EXPIRED, NOW.minus(1, ChronoUnit.DAYS));
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.cancel(s.getSubscriptionId())).isFalse();
        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
        verifyNoInteractions(events);
    }

    @Test
    void resume_failsAfterGraceHasPassed() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.CANCELED, NOW.minus(5, ChronoUnit.DAYS));
        s.setGraceEndsAt(NOW.minus(2, ChronoUnit.DAYS));
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.resume(s.getSubscriptionId())).isFalse();
        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
    }

    @Test
    void renew_runsBillingHooksAndPublishes() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        Instant endsAt = NOW.plus(2, ChronoUnit.DAYS);
        SubscriptionEntity s = subscription(plan, pricing, SubscriptionStatus.ACTIVE, endsAt);
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));
        when(planCatalog.getPricing(pricing.getPlanPricingId())).thenReturn(pricing);
        when(subscriptionRepository.saveAndFlush(s)).thenReturn(s);

        assertThat(service.renew(s.getSubscriptionId())).isTrue();

        assertThat(s.getEndsAt()).isEqualTo(endsAt.plus(30, ChronoUnit.DAYS));
        verify(billingHook).beforeRenewal(any(SubscriptionSnapshot.class), eq(pricing), eq(false));
        verify(billingHook).afterRenewal(any(SubscriptionSnapshot.class), eq(pricing), eq(false));
        SubscriptionRenewed event = (SubscriptionRenewed) singleEvent();
        assertThat(event.automatic()).isFalse();
        assertThat(event.previousEndsAt()).isEqualTo(endsAt);
    }

    @Test
    void renew_vetoedByBillingHookLeavesSubscriptionUntouched() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        Instant endsAt = NOW.minus(1, ChronoUnit.DAYS);
        SubscriptionEntity s = subscription(plan, pricing, SubscriptionStatus.ACTIVE, endsAt);
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));
        when(planCatalog.getPricing(pricing.getPlanPricingId())).thenReturn(pricing);
        doThrow(new IllegalStateException("card declined"))
                .when(billingHook).beforeRenewal(any(SubscriptionSnapshot.class), eq(pricing), eq(true));

        assertThatThrownBy(() -> service.autoRenew(s.getSubscriptionId()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("card declined");
        assertThat(s.getEndsAt()).isEqualTo(endsAt);
        verifyNoInteractions(events);
    }

    @Test
    void autoRenew_skipsWhenNoLongerDue() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(3, ChronoUnit.DAYS));
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.autoRenew(s.getSubscriptionId())).isFalse();
        verifyNoInteractions(billingHook, events);
    }

    @Test
    void expireIfOverdue_expiresPastGrace() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.minus(5, ChronoUnit.DAYS));
        s.setGraceEndsAt(NOW.minus(2, ChronoUnit.DAYS));
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.expireIfOverdue(s.getSubscriptionId())).isTrue();

        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
        SubscriptionExpired event = (SubscriptionExpired) singleEvent();
        assertThat(event.wasInGrace()).isFalse();
    }

    @Test
    void expireIfOverdue_leavesSubscriptionStillInGrace() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.minus(1, ChronoUnit.DAYS));
        s.setGraceEndsAt(NOW.plus(2, ChronoUnit.DAYS));
        when(subscriptionRepository.findByIdForUpdate(s.getSubscriptionId())).thenReturn(Optional.of(s));

        assertThat(service.expireIfOverdue(s.getSubscriptionId())).isFalse();
        assertThat(s.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void consumeFeature_publishesUnlimitedSentinel() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(10, ChronoUnit.DAYS));
        when(subscriptionRepository.findForSubscriber("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY)).thenReturn(List.of(s));
        when(metering.consumeFeature(s, "seats", 2, NOW))
                .thenReturn(new UsageMeteringService.Consumption(true, 7, OptionalLong.empty()));

        assertThat(service.consumeFeature(USER, "seats", 2)).isTrue();

        FeatureUsed event = (FeatureUsed) singleEvent();
        assertThat(event.remaining()).isEqualTo(FeatureUsed.UNLIMITED);
        assertThat(event.used()).isEqualTo(7);
        assertThat(event.amount()).isEqualTo(2);
    }

    @Test
    void consumeFeature_exhaustedReturnsFalseWithoutEvent() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(10, ChronoUnit.DAYS));
        when(subscriptionRepository.findForSubscriber("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY)).thenReturn(List.of(s));
        when(metering.consumeFeature(s, "api_calls", 10, NOW))
                .thenReturn(new UsageMeteringService.Consumption(false, 95, OptionalLong.of(5)));

        assertThat(service.consumeFeature(USER, "api_calls", 10)).isFalse();
        verifyNoInteractions(events);
    }

    @Test
    void consumeFeature_withoutSubscriptionReturnsFalse() {
        assertThat(service.consumeFeature(USER, "api_calls")).isFalse();
        verify(metering, never()).consumeFeature(any(), anyString(), anyLong(), any());
    }

    @Test
    void resetFeature_publishesPreviousCounter() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(10, ChronoUnit.DAYS));
        when(subscriptionRepository.findForSubscriber("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY)).thenReturn(List.of(s));
        when(metering.resetFeatureUsage(s, "api_calls")).thenReturn(Optional.of(42L));

        assertThat(service.resetFeature(USER, "api_calls")).isTrue();

        FeatureUsageReset event = (FeatureUsageReset) singleEvent();
        assertThat(event.featureKey()).isEqualTo("api_calls");
        assertThat(event.previousUsed()).isEqualTo(42);
        assertThat(event.subscription().subscriptionId()).isEqualTo(s.getSubscriptionId());
    }

    @Test
    void resetFeature_withoutRecordedUsageReturnsFalse() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(10, ChronoUnit.DAYS));
        when(subscriptionRepository.findForSubscriber("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY)).thenReturn(List.of(s));
        when(metering.resetFeatureUsage(s, "exports")).thenReturn(Optional.empty());

        assertThat(service.resetFeature(USER, "exports")).isFalse();
        assertThatThrownBy(() -> service.resetFeature(USER, "bad key!"))
                .isInstanceOf(SubscriptionValidationException.class);
        verifyNoInteractions(events);
    }

    @Test
    void resetAllFeatures_publishesOneEventPerCounter() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity s = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(10, ChronoUnit.DAYS));
        when(subscriptionRepository.findForSubscriber("user", "u-1", SubscriptionStatus.ACTIVE_FAMILY)).thenReturn(List.of(s));
        Map<String, Long> previous = new LinkedHashMap<>();
        previous.put("api_calls", 50L);
        previous.put("exports", 4L);
        when(metering.resetAllUsages(s)).thenReturn(previous);

        assertThat(service.resetAllFeatures(USER)).isEqualTo(2);

        ArgumentCaptor<SubscriptionEvent> captor = ArgumentCaptor.forClass(SubscriptionEvent.class);
        verify(events, times(2)).publish(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(e -> ((FeatureUsageReset) e).featureKey() + "=" + ((FeatureUsageReset) e).previousUsed())
                .containsExactly("api_calls=50", "exports=4");
    }

    @Test
    void resetAllFeatures_withoutSubscriptionResetsNothing() {
        assertThat(service.resetAllFeatures(USER)).isZero();
        verifyNoInteractions(metering, events);
    }

    @Test
    void duplicate_createsFreshSubscriptionWithZeroedUsage() {
        PlanEntity plan = plan("basic");
        PlanPricingEntity pricing = pricing(plan, 30, "10.00");
        SubscriptionEntity source = subscription(plan, pricing, SubscriptionStatus.EXPIRED, NOW.minus(3, ChronoUnit.DAYS));
        when(subscriptionRepository.findById(source.getSubscriptionId())).thenReturn(Optional.of(source));
        when(planCatalog.getAvailablePlan(plan.getPlanId())).thenReturn(plan);
        when(planCatalog.getPricingForPlan(plan.getPlanId(), pricing.getPlanPricingId())).thenReturn(pricing);
        stubInsert();

        SubscriptionSnapshot copy = service.duplicate(source.getSubscriptionId(), false);

        assertThat(copy.subscriptionId()).isNotEqualTo(source.getSubscriptionId());
        assertThat(copy.status()).isEqualTo(SubscriptionStatus.ACTIVE);
        verify(metering).copyUsages(eq(source), any(SubscriptionEntity.class), eq(true));

        ArgumentCaptor<SubscriptionEvent> captor = ArgumentCaptor.forClass(SubscriptionEvent.class);
        verify(events, times(2)).publish(captor.capture());
        assertThat(captor.getAllValues().get(0)).isInstanceOf(SubscriptionCreated.class);
        assertThat(((SubscriptionCreated) captor.getAllValues().get(0)).metadata())
                .containsEntry("action", "duplicate")
                .containsEntry("original_subscription_id", source.getSubscriptionId().toString());
        assertThat(captor.getAllValues().get(1)).isInstanceOf(SubscriptionStarted.class);
    }

    @Test
    void duplicate_rejectsActiveSource() {
        PlanEntity plan = plan("basic");
        SubscriptionEntity source = subscription(plan, pricing(plan, 30, "10.00"), SubscriptionStatus.ACTIVE, NOW.plus(3, ChronoUnit.DAYS));
        when(subscriptionRepository.findById(source.getSubscriptionId())).thenReturn(Optional.of(source));

        assertThatThrownBy(() -> service.duplicate(source.getSubscriptionId(), true))
                .isInstanceOf(SubscriptionValidationException.class);
    }

    @Test
    void healthStatus_warnsAboutOverdueSubscriptions() {
        when(subscriptionRepository.countByStatus()).thenReturn(List.of(
                statusCount(SubscriptionStatus.ACTIVE, 8),
                statusCount(SubscriptionStatus.TRIAL, 2),
                statusCount(SubscriptionStatus.EXPIRED, 5)
        ));
        when(subscriptionRepository.countOverdue(eq(SubscriptionStatus.ACTIVE_FAMILY), eq(NOW))).thenReturn(1L);
        when(subscriptionRepository.countByAutoRenewalTrueAndDeletedAtIsNull()).thenReturn(6L);

        SubscriptionQueries.HealthStatus health = service.healthStatus();

        assertThat(health.status()).isEqualTo("warning");
        assertThat(health.isHealthy()).isFalse();
        assertThat(health.activeSubscriptions()).isEqualTo(10);
        assertThat(health.overdueSubscriptions()).isEqualTo(1);
        assertThat(health.autoRenewalEnabled()).isEqualTo(6);
    }

    @Test
    void statistics_fillsMissingStatusesWithZero() {
        when(subscriptionRepository.countByStatus()).thenReturn(List.of(statusCount(SubscriptionStatus.ACTIVE, 3)));

        SubscriptionQueries.SubscriptionStatistics stats = service.statistics();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.count(SubscriptionStatus.ACTIVE)).isEqualTo(3);
        assertThat(stats.count(SubscriptionStatus.CANCELED)).isZero();
        assertThat(stats.byStatus()).hasSize(SubscriptionStatus.values().length);
    }

    private void stubInsert() {
        when(subscriptionRepository.saveAndFlush(any(SubscriptionEntity.class))).thenAnswer(inv -> {
            SubscriptionEntity s = inv.getArgument(0);
            if (s.getSubscriptionId() == null) {
                s.setSubscriptionId(UUID.randomUUID());
            }
            return s;
        });
    }

    private SubscriptionEvent singleEvent() {
        ArgumentCaptor<SubscriptionEvent> captor = ArgumentCaptor.forClass(SubscriptionEvent.class);
        verify(events).publish(captor.capture());
        return captor.getValue();
    }

    private static PlanEntity plan(String slug) {
        PlanEntity plan = new PlanEntity();
        plan.setPlanId(UUID.randomUUID());
        plan.setSlug(slug);
        plan.setActive(true);
        return plan;
    }

    private static PlanPricingEntity pricing(PlanEntity plan, Integer days, String price) {
        PlanPricingEntity pricing = new PlanPricingEntity();
        pricing.setPlanPricingId(UUID.randomUUID());
        pricing.setPlanId(plan.getPlanId());
        pricing.setLabel(days == null ? "lifetime" : "monthly");
        pricing.setDurationInDays(days);
        pricing.setPrice(new BigDecimal(price));
        return pricing;
    }

    private static SubscriptionEntity subscription(PlanEntity plan,
                                                   PlanPricingEntity pricing,
                                                   SubscriptionStatus status,
                                                   Instant endsAt) {
        SubscriptionEntity s = new SubscriptionEntity();
        s.setSubscriptionId(UUID.randomUUID());
        s.setSubscriber(USER);
        s.setPlanId(plan.getPlanId());
        s.setPlanPricingId(pricing.getPlanPricingId());
        s.setStatus(status);
        s.setAutoRenewal(true);
        s.setStartsAt(NOW.minus(10, ChronoUnit.DAYS));
        s.setEndsAt(endsAt);
        return s;
    }

    private static SubscriptionRepository.StatusCount statusCount(SubscriptionStatus status, long total) {
        return new SubscriptionRepository.StatusCount() {
            @Override
            public SubscriptionStatus getStatus() {
                return status;
            }

            @Override
            public long getTotal() {
                return total;
            }
        };
    }
}
