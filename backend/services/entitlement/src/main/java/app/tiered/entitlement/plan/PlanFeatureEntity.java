package app.tiered.entitlement.plan;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.ColumnTransformer;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "plan_features",
        schema = "app_entitlement",
        uniqueConstraints = @UniqueConstraint(columnNames = {"plan_id", "feature_key"})
)
public class PlanFeatureEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "plan_feature_id", nullable = false)
    private UUID planFeatureId;

    @Column(name = "plan_id", nullable = false)
    private UUID planId;

    // Join key against subscription_usages; never renamed once subscriptions exist.
    @Column(name = "feature_key", nullable = false, updatable = false)
    private String featureKey;

    @Convert(converter = OrderedJsonConverter.class)
    @ColumnTransformer(write = "?::json")
    @Column(name = "name", columnDefinition = "json")
    private JsonNode name;

    @Convert(converter = OrderedJsonConverter.class)
    @ColumnTransformer(write = "?::json")
    @Column(name = "description", columnDefinition = "json")
    private JsonNode description;

    @Convert(converter = OrderedJsonConverter.class)
    @ColumnTransformer(write = "?::json")
    @Column(name = "feature_value", columnDefinition = "json")
    private JsonNode featureValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "reset_period", nullable = false)
    private FeatureResetPeriod resetPeriod = FeatureResetPeriod.NEVER;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public UUID getPlanFeatureId() {
        return planFeatureId;
    }

    public void setPlanFeatureId(UUID planFeatureId) {
        this.planFeatureId = planFeatureId;
    }

    public UUID getPlanId() {
        return planId;
    }

    public void setPlanId(UUID planId) {
        this.planId = planId;
    }

    public String getFeatureKey() {
        return featureKey;
    }

    public void setFeatureKey(String featureKey) {
        this.featureKey = featureKey;
    }

    public JsonNode getName() {
        return name;
    }

    public void setName(JsonNode name) {
        this.name = name;
    }

    public JsonNode getDescription() {
        return description;
    }

    public void setDescription(JsonNode description) {
        this.description = description;
    }

    public JsonNode getFeatureValue() {
        return featureValue;
    }

    public void setFeatureValue(JsonNode featureValue) {
        this.featureValue = featureValue;
    }

    public FeatureResetPeriod getResetPeriod() {
        return resetPeriod == null ? FeatureResetPeriod.NEVER : resetPeriod;
    }

    public void setResetPeriod(FeatureResetPeriod resetPeriod) {
        this.resetPeriod = resetPeriod;
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
