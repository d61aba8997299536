package app.tiered.entitlement.subscription;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SubscriptionEntity s where s.subscriptionId = :id")
    Optional<SubscriptionEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        select s
        from SubscriptionEntity s
        where s.subscriberType = :type
          and s.subscriberId = :subscriberId
          and s.status in :statuses
          and s.deletedAt is null
        order by s.createdAt desc
        """)
    List<SubscriptionEntity> findForSubscriber(@Param("type") String type,
                                               @Param("subscriberId") String subscriberId,
                                               @Param("statuses") Collection<SubscriptionStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select s
        from SubscriptionEntity s
        where s.subscriberType = :type
          and s.subscriberId = :subscriberId
          and s.status in :statuses
          and s.deletedAt is null
        order by s.createdAt desc
        """)
    List<SubscriptionEntity> findForSubscriberForUpdate(@Param("type") String type,
                                                        @Param("subscriberId") String subscriberId,
                                                        @Param("statuses") Collection<SubscriptionStatus> statuses);

    @Query("""
        select s
        from SubscriptionEntity s
        where s.subscriberType = :type
          and s.subscriberId = :subscriberId
          and s.deletedAt is null
        order by s.createdAt desc
        """)
    List<SubscriptionEntity> findHistory(@Param("type") String type,
                                         @Param("subscriberId") String subscriberId);

    @Query("""
        select s
        from SubscriptionEntity s
        where s.status in :statuses
          and s.deletedAt is null
          and s.endsAt is not null
          and s.endsAt >= :now
          and s.endsAt <= :until
        order by s.endsAt asc
        """)
    List<SubscriptionEntity> findExpiringBetween(@Param("statuses") Collection<SubscriptionStatus> statuses,
                                                 @Param("now") Instant now,
                                                 @Param("until") Instant until);

    /**
     * Active-family rows whose grace window, or paid window when there is no grace, has passed.
     */
    @Query("""
        select s.subscriptionId
        from SubscriptionEntity s
        where s.status in :statuses
          and s.deletedAt is null
          and (
                (s.graceEndsAt is not null and s.graceEndsAt < :now)
             or (s.graceEndsAt is null and s.endsAt is not null and s.endsAt < :now)
          )
        order by s.endsAt asc, s.subscriptionId asc
        """)
    List<UUID> findOverdueIds(@Param("statuses") Collection<SubscriptionStatus> statuses,
                              @Param("now") Instant now,
                              Pageable pageable);

    @Query("""
        select count(s)
        from SubscriptionEntity s
        where s.status in :statuses
          and s.deletedAt is null
          and (
                (s.graceEndsAt is not null and s.graceEndsAt < :now)
             or (s.graceEndsAt is null and s.endsAt is not null and s.endsAt < :now)
          )
        """)
    long countOverdue(@Param("statuses") Collection<SubscriptionStatus> statuses,
                      @Param("now") Instant now);

    @Query("""
        select s.subscriptionId
        from SubscriptionEntity s
        where s.autoRenewal = true
          and s.status = app.tiered.entitlement.subscription.SubscriptionStatus.ACTIVE
          and s.deletedAt is null
          and s.endsAt is not null
          and s.endsAt <= :now
        order by s.endsAt asc, s.subscriptionId asc
        """)
    List<UUID> findRenewalCandidateIds(@Param("now") Instant now, Pageable pageable);

    @Query("""
        select count(s) > 0
        from SubscriptionEntity s
        where s.subscriberType = :type
          and s.subscriberId = :subscriberId
          and s.planId = :planId
          and s.trialEndsAt is not null
        """)
    boolean existsTrialForPlan(@Param("type") String type,
                               @Param("subscriberId") String subscriberId,
                               @Param("planId") UUID planId);

    @Query("""
        select count(s) > 0
        from SubscriptionEntity s
        where s.subscriberType = :type
          and s.subscriberId = :subscriberId
          and s.trialEndsAt is not null
        """)
    boolean existsAnyTrial(@Param("type") String type,
                           @Param("subscriberId") String subscriberId);

    @Query("""
        select s.status as status, count(s) as total
        from SubscriptionEntity s
        where s.deletedAt is null
        group by s.status
        """)
    List<StatusCount> countByStatus();

    long countByAutoRenewalTrueAndDeletedAtIsNull();

    interface StatusCount {
        SubscriptionStatus getStatus();

        long getTotal();
    }
}
