package app.tiered.entitlement.job;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one sweep. {@code processed} counts items actually changed; in a dry run it is always zero
 * and {@code selected} reports what would have been touched.
 */
public record BatchResult(String job,
                          int selected,
                          int processed,
                          int skipped,
                          int failed,
                          boolean dryRun,
                          List<UUID> failedIds) {

    public BatchResult {
        failedIds = List.copyOf(failedIds);
    }

    public static BatchResult dryRun(String job, int selected) {
        return new BatchResult(job, selected, 0, 0, 0, true, List.of());
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public static BatchResult merge(String job, List<BatchResult> parts) {
        int selected = 0;
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        boolean dryRun = false;
        List<UUID> failedIds = new ArrayList<>();
        for (BatchResult part : parts) {
            selected += part.selected();
            processed += part.processed();
            skipped += part.skipped();
            failed += part.failed();
            dryRun |= part.dryRun();
            failedIds.addAll(part.failedIds());
        }
        return new BatchResult(job, selected, processed, skipped, failed, dryRun, failedIds);
    }
}
