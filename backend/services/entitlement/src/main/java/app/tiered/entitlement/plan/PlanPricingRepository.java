package app.tiered.entitlement.plan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlanPricingRepository extends JpaRepository<PlanPricingEntity, UUID> {

    Optional<PlanPricingEntity> findByPlanPricingIdAndPlanId(UUID planPricingId, UUID planId);

    List<PlanPricingEntity> findByPlanIdOrderByPriceAscDurationInDaysAscPlanPricingIdAsc(UUID planId);
}
