package app.tiered.entitlement.plan;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "plan_prices", schema = "app_entitlement")
public class PlanPriceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "plan_price_id", nullable = false)
    private UUID planPriceId;

    @Column(name = "plan_pricing_id", nullable = false)
    private UUID planPricingId;

    @Column(name = "currency_code", nullable = false, length = 3)
    private String currencyCode;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    public UUID getPlanPriceId() {
        return planPriceId;
    }

    public void setPlanPriceId(UUID planPriceId) {
        this.planPriceId = planPriceId;
    }

    public UUID getPlanPricingId() {
        return planPricingId;
    }

    public void setPlanPricingId(UUID planPricingId) {
        this.planPricingId = planPricingId;
    }

    public String getCurrencyCode() {
        return currencyCode;
    }

    public void setCurrencyCode(String currencyCode) {
        this.currencyCode = currencyCode;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }
}
