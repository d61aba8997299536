package app.tiered.entitlement.usage;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.FeatureResetPeriod;
import app.tiered.entitlement.plan.PlanCatalog;
import app.tiered.entitlement.plan.PlanFeatureEntity;
import app.tiered.entitlement.subscription.SubscriptionEntity;
import app.tiered.entitlement.subscription.SubscriptionStateMachine;
import app.tiered.entitlement.subscription.SubscriptionStatus;
import app.tiered.entitlement.support.SubscriptionValidationException;
import app.tiered.entitlement.value.FlexibleValue;
import app.tiered.entitlement.value.FlexibleValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Per-subscription feature consumption against plan limits, with calendar-based resets.
 * Callers pass the subscription row; this service never looks up the subscriber.
 */
@Service
public class UsageMeteringService {

    private static final Logger log = LoggerFactory.getLogger(UsageMeteringService.class);

    private static final Pattern FEATURE_KEY = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private final SubscriptionUsageRepository usageRepository;
    private final PlanCatalog planCatalog;
    private final FlexibleValueCodec codec;
    private final SubscriptionStateMachine stateMachine;
    private final EntitlementProps props;

    public UsageMeteringService(SubscriptionUsageRepository usageRepository,
                                PlanCatalog planCatalog,
                                FlexibleValueCodec codec,
                                SubscriptionStateMachine stateMachine,
                                EntitlementProps props) {
        this.usageRepository = usageRepository;
        this.planCatalog = planCatalog;
        this.codec = codec;
        this.stateMachine = stateMachine;
        this.props = props;
    }

    public static void requireValidKey(String featureKey) {
        if (featureKey == null || !FEATURE_KEY.matcher(featureKey).matches()) {
            throw new SubscriptionValidationException("Invalid feature key: " + featureKey);
        }
    }

    public static void requirePositiveAmount(long amount) {
        if (amount <= 0) {
            throw new SubscriptionValidationException("Consumption amount must be positive: " + amount);
        }
    }

    @Transactional(readOnly = true)
    public boolean hasFeature(SubscriptionEntity subscription, String featureKey) {
        requireValidKey(featureKey);
        return planCatalog.findFeature(subscription.getPlanId(), featureKey).isPresent();
    }

    /**
     * Decoded feature value for {@code locale}. Empty when the plan has no such feature;
     * a present {@link FlexibleValue#ofNull()} means unlimited.
     */
    @Transactional(readOnly = true)
    public Optional<FlexibleValue> getFeatureValue(SubscriptionEntity subscription, String featureKey, String locale) {
        requireValidKey(featureKey);
        return planCatalog.findFeature(subscription.getPlanId(), featureKey)
                .map(feature -> valueOf(feature, locale));
    }

    /**
     * Current counter as seen by the next consumption, so a counter whose period elapsed reads 0.
     */
    @Transactional(readOnly = true)
    public long getFeatureUsage(SubscriptionEntity subscription, String featureKey, Instant now) {
        requireValidKey(featureKey);
        FeatureResetPeriod period = planCatalog.findFeature(subscription.getPlanId(), featureKey)
                .map(PlanFeatureEntity::getResetPeriod)
                .orElse(FeatureResetPeriod.NEVER);
        return usageRepository.findBySubscriptionIdAndFeatureKey(subscription.getSubscriptionId(), featureKey)
                .map(usage -> effectiveUsed(usage, period, now))
                .orElse(0L);
    }

    /**
     * {@code max(0, limit - used)}; empty when the feature is unlimited, non-numeric or missing.
     */
    @Transactional(readOnly = true)
    public OptionalLong getRemainingUsage(SubscriptionEntity subscription, String featureKey, Instant now) {
        requireValidKey(featureKey);
        Optional<PlanFeatureEntity> feature = planCatalog.findFeature(subscription.getPlanId(), featureKey);
        if (feature.isEmpty()) {
            return OptionalLong.empty();
        }
        OptionalLong limit = limitOf(feature.get());
        if (limit.isEmpty()) {
            return OptionalLong.empty();
        }
        long used = usageRepository.findBySubscriptionIdAndFeatureKey(subscription.getSubscriptionId(), featureKey)
                .map(usage -> effectiveUsed(usage, feature.get().getResetPeriod(), now))
                .orElse(0L);
        return OptionalLong.of(Math.max(0, limit.getAsLong() - used));
    }

    @Transactional(readOnly = true)
    public boolean isFeatureExhausted(SubscriptionEntity subscription, String featureKey, Instant now) {
        OptionalLong remaining = getRemainingUsage(subscription, featureKey, now);
        return remaining.isPresent() && remaining.getAsLong() <= 0;
    }

    @Transactional(readOnly = true)
    public boolean canConsumeFeature(SubscriptionEntity subscription, String featureKey, long amount, Instant now) {
        requireValidKey(featureKey);
        requirePositiveAmount(amount);
        if (!hasFeature(subscription, featureKey) || !stateMachine.isActive(subscription, now)) {
            return false;
        }
        OptionalLong remaining = getRemainingUsage(subscription, featureKey, now);
        return remaining.isEmpty() || remaining.getAsLong() >= amount;
    }

    /**
     * Records {@code amount} units. The usage row is locked for the whole check-then-increment,
     * and an elapsed reset period zeroes the counter before the limit is evaluated.
     */
    @Transactional
    public Consumption consumeFeature(SubscriptionEntity subscription, String featureKey, long amount, Instant now) {
        requireValidKey(featureKey);
        requirePositiveAmount(amount);

        Optional<PlanFeatureEntity> featureOpt = planCatalog.findFeature(subscription.getPlanId(), featureKey);
        if (featureOpt.isEmpty()) {
            return Consumption.rejected(0, OptionalLong.empty());
        }
        if (!stateMachine.isActive(subscription, now)) {
            return Consumption.rejected(0, OptionalLong.empty());
        }
        PlanFeatureEntity feature = featureOpt.get();
        SubscriptionUsageEntity usage = lockUsage(subscription.getSubscriptionId(), featureKey, now);

        boolean reset = resetIfDue(usage, feature.getResetPeriod(), now);
        OptionalLong limit = limitOf(feature);
        if (limit.isPresent() && amount > limit.getAsLong() - usage.getUsed()) {
            if (reset) {
                usageRepository.save(usage);
            }
            long remaining = Math.max(0, limit.getAsLong() - usage.getUsed());
            return Consumption.rejected(usage.getUsed(), OptionalLong.of(remaining));
        }
        if (usage.getUsed() > Long.MAX_VALUE - amount) {
            log.warn("Usage counter would overflow: subscriptionId={}, key={}, used={}, amount={}",
                    subscription.getSubscriptionId(), featureKey, usage.getUsed(), amount);
            if (reset) {
                usageRepository.save(usage);
            }
            return Consumption.rejected(usage.getUsed(), limit);
        }

        usage.setUsed(usage.getUsed() + amount);
        usage.setLastUsedAt(now);
        usageRepository.save(usage);

        OptionalLong remaining = limit.isPresent()
                ? OptionalLong.of(Math.max(0, limit.getAsLong() - usage.getUsed()))
                : OptionalLong.empty();
        return new Consumption(true, usage.getUsed(), remaining);
    }

    /**
     * Zeroes one counter and returns its previous value. Empty when nothing was ever recorded.
     */
    @Transactional
    public Optional<Long> resetFeatureUsage(SubscriptionEntity subscription, String featureKey) {
        requireValidKey(featureKey);
        return usageRepository.findForUpdate(subscription.getSubscriptionId(), featureKey)
                .map(usage -> {
                    long previous = usage.getUsed();
                    usage.reset();
                    usageRepository.save(usage);
                    return previous;
                });
    }

    /**
     * Unconditionally zeroes every counter of the subscription and returns the previous values by key.
     */
    @Transactional
    public Map<String, Long> resetAllUsages(SubscriptionEntity subscription) {
        List<SubscriptionUsageEntity> usages = usageRepository.findAllForUpdate(subscription.getSubscriptionId());
        Map<String, Long> previous = new TreeMap<>();
        for (SubscriptionUsageEntity usage : usages) {
            previous.put(usage.getFeatureKey(), usage.getUsed());
            usage.reset();
        }
        usageRepository.saveAll(usages);
        return previous;
    }

    /**
     * Seeds the usage rows of {@code target} from {@code source}, either carrying counters over
     * or starting every copied feature at zero.
     */
    @Transactional
    public int copyUsages(SubscriptionEntity source, SubscriptionEntity target, boolean resetCounters) {
        List<SubscriptionUsageEntity> copies = new ArrayList<>();
        for (SubscriptionUsageEntity usage : usageRepository.findBySubscriptionIdOrderByFeatureKeyAsc(source.getSubscriptionId())) {
            SubscriptionUsageEntity copy = new SubscriptionUsageEntity();
            copy.setSubscriptionId(target.getSubscriptionId());
            copy.setFeatureKey(usage.getFeatureKey());
            if (!resetCounters) {
                copy.setUsed(usage.getUsed());
                copy.setLastUsedAt(usage.getLastUsedAt());
            }
            copies.add(copy);
        }
        usageRepository.saveAll(copies);
        return copies.size();
    }

    /**
     * Counters by feature key as the next consumption would see them, so elapsed periods read 0.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> currentUsage(SubscriptionEntity subscription, Instant now) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (SubscriptionUsageEntity usage : usageRepository.findBySubscriptionIdOrderByFeatureKeyAsc(subscription.getSubscriptionId())) {
            FeatureResetPeriod period = planCatalog.findFeature(subscription.getPlanId(), usage.getFeatureKey())
                    .map(PlanFeatureEntity::getResetPeriod)
                    .orElse(FeatureResetPeriod.NEVER);
            out.put(usage.getFeatureKey(), effectiveUsed(usage, period, now));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<FeatureUsageSummary> usageSummary(SubscriptionEntity subscription, String locale, Instant now) {
        List<FeatureUsageSummary> out = new ArrayList<>();
        ZoneId zone = props.zoneId();
        for (PlanFeatureEntity feature : planCatalog.features(subscription.getPlanId())) {
            FlexibleValue value = valueOf(feature, locale);
            OptionalLong limit = value.asLimit();
            long used = usageRepository.findBySubscriptionIdAndFeatureKey(subscription.getSubscriptionId(), feature.getFeatureKey())
                    .map(usage -> effectiveUsed(usage, feature.getResetPeriod(), now))
                    .orElse(0L);
            Long remaining = limit.isPresent() ? Math.max(0, limit.getAsLong() - used) : null;
            Double percentage = null;
            if (limit.isPresent() && limit.getAsLong() > 0) {
                percentage = Math.min(100.0, used * 100.0 / limit.getAsLong());
            }
            out.add(new FeatureUsageSummary(
                    feature.getFeatureKey(),
                    value,
                    used,
                    remaining,
                    remaining != null && remaining <= 0,
                    feature.getResetPeriod(),
                    percentage,
                    feature.getResetPeriod().nextReset(now, zone).orElse(null)
            ));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<UUID> findDueForReset(FeatureResetPeriod period, Instant now, int limit) {
        Optional<Instant> boundary = period.periodStart(now, props.zoneId());
        if (boundary.isEmpty()) {
            return List.of();
        }
        return usageRepository.findDueForReset(
                period,
                SubscriptionStatus.ACTIVE_FAMILY,
                boundary.get(),
                PageRequest.of(0, limit)
        );
    }

    @Transactional
    public int resetUsages(Collection<UUID> usageIds, Instant now) {
        if (usageIds.isEmpty()) {
            return 0;
        }
        int updated = usageRepository.resetByIds(usageIds, now);
        log.debug("Reset usage rows: requested={}, updated={}", usageIds.size(), updated);
        return updated;
    }

    private SubscriptionUsageEntity lockUsage(UUID subscriptionId, String featureKey, Instant now) {
        return usageRepository.findForUpdate(subscriptionId, featureKey)
                .orElseGet(() -> {
                    usageRepository.insertIfAbsent(subscriptionId, featureKey, now);
                    return usageRepository.findForUpdate(subscriptionId, featureKey)
                            .orElseThrow(() -> new IllegalStateException(
                                    "Usage row missing after insert: subscriptionId=" + subscriptionId + ", key=" + featureKey));
                });
    }

    private boolean resetIfDue(SubscriptionUsageEntity usage, FeatureResetPeriod period, Instant now) {
        if (!period.isDue(usage.getLastUsedAt(), now, props.zoneId())) {
            return false;
        }
        usage.reset();
        return true;
    }

    private long effectiveUsed(SubscriptionUsageEntity usage, FeatureResetPeriod period, Instant now) {
        return period.isDue(usage.getLastUsedAt(), now, props.zoneId()) ? 0L : usage.getUsed();
    }

    private FlexibleValue valueOf(PlanFeatureEntity feature, String locale) {
        String fallback = props.locale().fallback();
        return codec.resolveLocalized(feature.getFeatureValue(), locale == null ? fallback : locale, fallback);
    }

    private OptionalLong limitOf(PlanFeatureEntity feature) {
        return valueOf(feature, null).asLimit();
    }

    public record Consumption(boolean consumed, long used, OptionalLong remaining) {

        static Consumption rejected(long used, OptionalLong remaining) {
            return new Consumption(false, used, remaining);
        }

        /**
         * Remaining units, or -1 when the feature has no numeric limit.
         */
        public long remainingOrUnlimited() {
            return remaining.isPresent() ? remaining.getAsLong() : -1L;
        }
    }

    public record FeatureUsageSummary(String featureKey,
                                      FlexibleValue value,
                                      long used,
                                      Long remaining,
                                      boolean exhausted,
                                      FeatureResetPeriod resetPeriod,
                                      Double percentageUsed,
                                      Instant nextResetAt) {
    }
}
