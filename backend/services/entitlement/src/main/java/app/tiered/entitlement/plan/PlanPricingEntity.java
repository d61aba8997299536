package app.tiered.entitlement.plan;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "plan_pricings", schema = "app_entitlement")
public class PlanPricingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "plan_pricing_id", nullable = false)
    private UUID planPricingId;

    @Column(name = "plan_id", nullable = false)
    private UUID planId;

    @Column(name = "label", nullable = false)
    private String label;

    @Column(name = "duration_in_days")
    private Integer durationInDays;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "is_best_offer", nullable = false)
    private boolean bestOffer;

    @OneToMany(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_pricing_id", referencedColumnName = "plan_pricing_id", insertable = false, updatable = false)
    private List<PlanPriceEntity> prices = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public UUID getPlanPricingId() {
        return planPricingId;
    }

    public void setPlanPricingId(UUID planPricingId) {
        this.planPricingId = planPricingId;
    }

    public UUID getPlanId() {
        return planId;
    }

    public void setPlanId(UUID planId) {
        this.planId = planId;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public Integer getDurationInDays() {
        return durationInDays;
    }

    public void setDurationInDays(Integer durationInDays) {
        this.durationInDays = durationInDays;
    }

    public boolean isLifetime() {
        return durationInDays == null || durationInDays <= 0;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public boolean isBestOffer() {
        return bestOffer;
    }

    public void setBestOffer(boolean bestOffer) {
        this.bestOffer = bestOffer;
    }

    public List<PlanPriceEntity> getPrices() {
        return prices;
    }

    public void setPrices(List<PlanPriceEntity> prices) {
        this.prices = prices;
    }

    public Optional<PlanPriceEntity> priceFor(String currencyCode) {
        if (currencyCode == null || prices == null) {
            return Optional.empty();
        }
        return prices.stream()
                .filter(p -> currencyCode.equalsIgnoreCase(p.getCurrencyCode()))
                .findFirst();
    }

    /**
     * Amount in the requested currency, then in the default currency, then the base price.
     * Without fallback only an exact currency match is returned.
     */
    public Optional<BigDecimal> priceIn(String currencyCode, String defaultCurrency, boolean fallbackToDefault) {
        Optional<BigDecimal> exact = priceFor(currencyCode).map(PlanPriceEntity::getAmount);
        if (exact.isPresent() || !fallbackToDefault) {
            return exact;
        }
        Optional<BigDecimal> inDefault = priceFor(defaultCurrency).map(PlanPriceEntity::getAmount);
        if (inDefault.isPresent()) {
            return inDefault;
        }
        return Optional.ofNullable(price);
    }

    public BigDecimal defaultPrice() {
        return price == null ? BigDecimal.ZERO : price;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
