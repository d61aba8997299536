package app.tiered.entitlement.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "app.entitlement")
public record EntitlementProps(
        @Min(0) Integer gracePeriodDays,
        @Min(1) Integer trialPeriodDays,
        Boolean autoRenewalDefault,
        String timeZone,
        Trial trial,
        PlanChanges planChanges,
        Localization locale,
        Currency currency,
        Jobs jobs
) {

    public EntitlementProps {
        gracePeriodDays = gracePeriodDays == null ? 3 : gracePeriodDays;
        trialPeriodDays = trialPeriodDays == null ? 14 : trialPeriodDays;
        autoRenewalDefault = autoRenewalDefault == null ? Boolean.TRUE : autoRenewalDefault;
        timeZone = (timeZone == null || timeZone.isBlank()) ? "UTC" : timeZone;
        trial = trial == null ? new Trial(null, null, null) : trial;
        planChanges = planChanges == null ? new PlanChanges(null, null, null, null) : planChanges;
        locale = locale == null ? new Localization(null) : locale;
        currency = currency == null ? new Currency(null, null) : currency;
        jobs = jobs == null ? new Jobs(null, null, null, null, null, null, null, null) : jobs;
    }

    public static EntitlementProps defaults() {
        return new EntitlementProps(null, null, null, null, null, null, null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    public record Trial(Integer minDays, Integer maxDays, Boolean allowMultipleTrialsPerPlan) {
        public Trial {
            minDays = minDays == null ? 3 : minDays;
            maxDays = maxDays == null ? 30 : maxDays;
            allowMultipleTrialsPerPlan = allowMultipleTrialsPerPlan != null && allowMultipleTrialsPerPlan;
            if (minDays < 1 || maxDays < minDays) {
                throw new IllegalStateException("Invalid app.entitlement.trial bounds: min=" + minDays + ", max=" + maxDays);
            }
        }
    }

    public record PlanChanges(Boolean allowDowngrades,
                              Boolean preventDowngradeWithExcessUsage,
                              Boolean allowPlanChangeDuringTrial,
                              Boolean resetUsageOnPlanChange) {
        public PlanChanges {
            allowDowngrades = allowDowngrades == null || allowDowngrades;
            preventDowngradeWithExcessUsage = preventDowngradeWithExcessUsage == null || preventDowngradeWithExcessUsage;
            allowPlanChangeDuringTrial = allowPlanChangeDuringTrial == null || allowPlanChangeDuringTrial;
            resetUsageOnPlanChange = resetUsageOnPlanChange == null || resetUsageOnPlanChange;
        }
    }

    public record Localization(String fallback) {
        public Localization {
            fallback = (fallback == null || fallback.isBlank()) ? "en" : fallback;
        }
    }

    public record Currency(String defaultCode, Boolean fallbackToDefault) {
        public Currency {
            defaultCode = (defaultCode == null || defaultCode.isBlank()) ? "USD" : defaultCode.toUpperCase();
            fallbackToDefault = fallbackToDefault == null || fallbackToDefault;
        }
    }

    public record Jobs(Boolean enabled,
                       String expireCron,
                       String renewCron,
                       String dailyResetCron,
                       String monthlyResetCron,
                       String yearlyResetCron,
                       Integer batchSize,
                       Boolean dryRun) {
        public Jobs {
            enabled = enabled == null || enabled;
            expireCron = blankTo(expireCron, "0 0 * * * *");
            renewCron = blankTo(renewCron, "0 0 * * * *");
            dailyResetCron = blankTo(dailyResetCron, "0 0 0 * * *");
            monthlyResetCron = blankTo(monthlyResetCron, "0 0 0 1 * *");
            yearlyResetCron = blankTo(yearlyResetCron, "0 0 0 1 1 *");
            batchSize = (batchSize == null || batchSize < 1) ? 500 : batchSize;
            dryRun = dryRun != null && dryRun;
        }

        private static String blankTo(String value, String fallback) {
            return (value == null || value.isBlank()) ? fallback : value;
        }
    }
}
