package app.tiered.entitlement.subscription;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record PlanChangeSummary(ChangeType changeType,
                                UUID oldPlanId,
                                UUID newPlanId,
                                UUID oldPricingId,
                                UUID newPricingId,
                                String oldPricingLabel,
                                String newPricingLabel,
                                String currency,
                                BigDecimal prorationAmount,
                                boolean usageReset,
                                Instant changedAt) {

    public enum ChangeType {
        UPGRADE,
        DOWNGRADE,
        LATERAL;

        public static ChangeType compare(BigDecimal oldPrice, BigDecimal newPrice) {
            int cmp = newPrice.compareTo(oldPrice);
            if (cmp > 0) {
                return UPGRADE;
            }
            return cmp < 0 ? DOWNGRADE : LATERAL;
        }
    }
}
