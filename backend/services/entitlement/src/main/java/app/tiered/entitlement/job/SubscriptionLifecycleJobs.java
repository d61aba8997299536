package app.tiered.entitlement.job;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.FeatureResetPeriod;
import app.tiered.entitlement.subscription.SubscriptionService;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;
import app.tiered.entitlement.support.ErrorSummary;
import app.tiered.entitlement.usage.UsageMeteringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Periodic sweeps over subscriptions and usage counters. Every item runs in its own transaction
 * (the service methods are transactional), so one failing row never aborts the rest of the run.
 */
@Component
public class SubscriptionLifecycleJobs {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycleJobs.class);

    static final String EXPIRE_JOB = "expire-overdue";
    static final String RENEW_JOB = "auto-renew";
    static final String RESET_JOB = "reset-usage";

    private final SubscriptionService subscriptionService;
    private final UsageMeteringService metering;
    private final EntitlementProps props;
    private final Clock clock;

    public SubscriptionLifecycleJobs(SubscriptionService subscriptionService,
                                     UsageMeteringService metering,
                                     EntitlementProps props,
                                     Clock clock) {
        this.subscriptionService = subscriptionService;
        this.metering = metering;
        this.props = props;
        this.clock = clock;
    }

    public BatchResult expireOverdue(BatchOptions options) {
        List<UUID> ids = subscriptionService.overdueSubscriptionIds(limit(options));
        if (options.dryRun()) {
            log.info("Dry run: job={}, selected={}, ids={}", EXPIRE_JOB, ids.size(), ids);
            return BatchResult.dryRun(EXPIRE_JOB, ids.size());
        }
        int processed = 0;
        int skipped = 0;
        List<UUID> failed = new ArrayList<>();
        for (UUID id : ids) {
            try {
                if (subscriptionService.expireIfOverdue(id)) {
                    processed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException ex) {
                failed.add(id);
                logFailure(EXPIRE_JOB, id, ex);
            }
        }
        return finish(new BatchResult(EXPIRE_JOB, ids.size(), processed, skipped, failed.size(), false, failed));
    }

    public BatchResult autoRenewEligible(BatchOptions options) {
        List<UUID> ids = subscriptionService.renewalCandidateIds(limit(options));
        if (options.dryRun()) {
            log.info("Dry run: job={}, selected={}, ids={}", RENEW_JOB, ids.size(), ids);
            return BatchResult.dryRun(RENEW_JOB, ids.size());
        }
        int processed = 0;
        int skipped = 0;
        List<UUID> failed = new ArrayList<>();
        for (UUID id : ids) {
            try {
                if (subscriptionService.autoRenew(id)) {
                    processed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException ex) {
                failed.add(id);
                logFailure(RENEW_JOB, id, ex);
                reportRenewalFailure(id, ex);
            }
        }
        return finish(new BatchResult(RENEW_JOB, ids.size(), processed, skipped, failed.size(), false, failed));
    }

    /**
     * Zeroes counters whose last use predates the current period boundary. Rows are reset in chunks;
     * a failing chunk is retried row by row so only the bad rows are reported.
     */
    public BatchResult resetDueUsage(FeatureResetPeriod period, BatchOptions options) {
        String job = RESET_JOB + ":" + period.name().toLowerCase();
        if (period == FeatureResetPeriod.NEVER) {
            return new BatchResult(job, 0, 0, 0, 0, options.dryRun(), List.of());
        }
        Instant now = clock.instant();
        List<UUID> ids = metering.findDueForReset(period, now, limit(options));
        if (options.dryRun()) {
            log.info("Dry run: job={}, selected={}", job, ids.size());
            return BatchResult.dryRun(job, ids.size());
        }
        int processed;
        List<UUID> failed = new ArrayList<>();
        try {
            processed = metering.resetUsages(ids, now);
        } catch (RuntimeException ex) {
            log.warn("Bulk usage reset failed, retrying per row: job={}, rows={}, error={}",
                    job, ids.size(), ErrorSummary.of(ex));
            processed = 0;
            for (UUID usageId : ids) {
                try {
                    processed += metering.resetUsages(List.of(usageId), now);
                } catch (RuntimeException rowEx) {
                    failed.add(usageId);
                    log.error("Usage reset failed: job={}, usageId={}, error={}",
                            job, usageId, ErrorSummary.of(rowEx), rowEx);
                }
            }
        }
        int skipped = ids.size() - processed - failed.size();
        return finish(new BatchResult(job, ids.size(), processed, Math.max(0, skipped), failed.size(), false, failed));
    }

    public BatchResult resetAllDueUsage(BatchOptions options) {
        List<BatchResult> parts = new ArrayList<>();
        for (FeatureResetPeriod period : FeatureResetPeriod.values()) {
            if (period != FeatureResetPeriod.NEVER) {
                parts.add(resetDueUsage(period, options));
            }
        }
        return BatchResult.merge(RESET_JOB, parts);
    }

    private int limit(BatchOptions options) {
        return options.limitOr(props.jobs().batchSize());
    }

    private void logFailure(String job, UUID subscriptionId, RuntimeException ex) {
        Optional<SubscriptionSnapshot> snapshot = lookup(subscriptionId);
        log.error("Sweep item failed: job={}, subscriptionId={}, subscriber={}, planId={}, error={}",
                job,
                subscriptionId,
                snapshot.map(s -> s.subscriber().toString()).orElse("unknown"),
                snapshot.map(s -> String.valueOf(s.planId())).orElse("unknown"),
                ErrorSummary.of(ex),
                ex);
    }

    private void reportRenewalFailure(UUID subscriptionId, RuntimeException cause) {
        try {
            subscriptionService.recordRenewalFailure(subscriptionId, ErrorSummary.of(cause));
        } catch (RuntimeException ex) {
            log.warn("Failed to record renewal failure: subscriptionId={}, error={}", subscriptionId, ErrorSummary.of(ex));
        }
    }

    private Optional<SubscriptionSnapshot> lookup(UUID subscriptionId) {
        try {
            return subscriptionService.findSnapshot(subscriptionId);
        } catch (RuntimeException ex) {
            log.debug("Snapshot lookup failed: subscriptionId={}, error={}", subscriptionId, ErrorSummary.of(ex));
            return Optional.empty();
        }
    }

    private static BatchResult finish(BatchResult result) {
        log.info("Sweep finished: job={}, selected={}, processed={}, skipped={}, failed={}",
                result.job(), result.selected(), result.processed(), result.skipped(), result.failed());
        return result;
    }
}
