package app.tiered.entitlement.job;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.FeatureResetPeriod;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.entitlement.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionLifecycleScheduler {

    private final SubscriptionLifecycleJobs jobs;
    private final EntitlementProps props;

    public SubscriptionLifecycleScheduler(SubscriptionLifecycleJobs jobs, EntitlementProps props) {
        this.jobs = jobs;
        this.props = props;
    }

    @Scheduled(cron = "${app.entitlement.jobs.expire-cron:0 0 * * * *}", zone = "${app.entitlement.time-zone:UTC}")
    public void expireOverdue() {
        jobs.expireOverdue(options());
    }

    @Scheduled(cron = "${app.entitlement.jobs.renew-cron:0 0 * * * *}", zone = "${app.entitlement.time-zone:UTC}")
    public void autoRenew() {
        jobs.autoRenewEligible(options());
    }

    @Scheduled(cron = "${app.entitlement.jobs.daily-reset-cron:0 0 0 * * *}", zone = "${app.entitlement.time-zone:UTC}")
    public void resetDaily() {
        jobs.resetDueUsage(FeatureResetPeriod.DAILY, options());
    }

    @Scheduled(cron = "${app.entitlement.jobs.monthly-reset-cron:0 0 0 1 * *}", zone = "${app.entitlement.time-zone:UTC}")
    public void resetMonthly() {
        jobs.resetDueUsage(FeatureResetPeriod.MONTHLY, options());
    }

    @Scheduled(cron = "${app.entitlement.jobs.yearly-reset-cron:0 0 0 1 1 *}", zone = "${app.entitlement.time-zone:UTC}")
    public void resetYearly() {
        jobs.resetDueUsage(FeatureResetPeriod.YEARLY, options());
    }

    private BatchOptions options() {
        return new BatchOptions(props.jobs().dryRun(), props.jobs().batchSize());
    }
}
