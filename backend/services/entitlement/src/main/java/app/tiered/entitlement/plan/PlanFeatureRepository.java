package app.tiered.entitlement.plan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlanFeatureRepository extends JpaRepository<PlanFeatureEntity, UUID> {

    Optional<PlanFeatureEntity> findByPlanIdAndFeatureKey(UUID planId, String featureKey);

    List<PlanFeatureEntity> findByPlanIdOrderByFeatureKeyAsc(UUID planId);
}
