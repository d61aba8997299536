package app.tiered.entitlement.usage;

import app.tiered.entitlement.plan.FeatureResetPeriod;
import app.tiered.entitlement.subscription.SubscriptionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionUsageRepository extends JpaRepository<SubscriptionUsageEntity, UUID> {

    Optional<SubscriptionUsageEntity> findBySubscriptionIdAndFeatureKey(UUID subscriptionId, String featureKey);

    List<SubscriptionUsageEntity> findBySubscriptionIdOrderByFeatureKeyAsc(UUID subscriptionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select u
        from SubscriptionUsageEntity u
        where u.subscriptionId = :subscriptionId
          and u.featureKey = :featureKey
        """)
    Optional<SubscriptionUsageEntity> findForUpdate(@Param("subscriptionId") UUID subscriptionId,
                                                    @Param("featureKey") String featureKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from SubscriptionUsageEntity u where u.subscriptionId = :subscriptionId")
    List<SubscriptionUsageEntity> findAllForUpdate(@Param("subscriptionId") UUID subscriptionId);

    @Modifying
    @Query(value = """
        insert into app_entitlement.subscription_usages
            (usage_id, subscription_id, feature_key, used, last_used_at, created_at, updated_at, row_version)
        values (gen_random_uuid(), :subscriptionId, :featureKey, 0, null, :now, :now, 0)
        on conflict (subscription_id, feature_key) do nothing
        """, nativeQuery = true)
    int insertIfAbsent(@Param("subscriptionId") UUID subscriptionId,
                       @Param("featureKey") String featureKey,
                       @Param("now") Instant now);

    /**
     * Usage rows of live subscriptions whose feature resets on {@code period} and that were last
     * touched before the current period started.
     */
    @Query("""
        select u.usageId
        from SubscriptionUsageEntity u
        join SubscriptionEntity s on s.subscriptionId = u.subscriptionId
        join PlanFeatureEntity f on f.planId = s.planId and f.featureKey = u.featureKey
        where f.resetPeriod = :period
          and s.status in :statuses
          and s.deletedAt is null
          and u.used > 0
          and u.lastUsedAt is not null
          and u.lastUsedAt < :boundary
        order by u.lastUsedAt asc, u.usageId asc
        """)
    List<UUID> findDueForReset(@Param("period") FeatureResetPeriod period,
                               @Param("statuses") Collection<SubscriptionStatus> statuses,
                               @Param("boundary") Instant boundary,
                               Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update SubscriptionUsageEntity u
        set u.used = 0,
            u.lastUsedAt = null,
            u.updatedAt = :now,
            u.rowVersion = u.rowVersion + 1
        where u.usageId in :ids
        """)
    int resetByIds(@Param("ids") Collection<UUID> ids, @Param("now") Instant now);
}
