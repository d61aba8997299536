package app.tiered.entitlement.job;

/**
 * Options for a single sweep run. A null {@code limit} means "use the configured batch size".
 */
public record BatchOptions(boolean dryRun, Integer limit) {

    public BatchOptions {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(false, null);
    }

    public static BatchOptions dryRun(Integer limit) {
        return new BatchOptions(true, limit);
    }

    int limitOr(int fallback) {
        return limit == null ? fallback : limit;
    }
}
