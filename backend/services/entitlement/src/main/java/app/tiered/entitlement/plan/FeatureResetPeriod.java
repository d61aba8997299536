package app.tiered.entitlement.plan;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

public enum FeatureResetPeriod {
    NEVER,
    DAILY,
    MONTHLY,
    YEARLY;

    /**
     * Start of the calendar period containing {@code now}, or empty for {@link #NEVER}.
     */
    public Optional<Instant> periodStart(Instant now, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate start;
        switch (this) {
            case DAILY -> start = today;
            case MONTHLY -> start = today.withDayOfMonth(1);
            case YEARLY -> start = today.withDayOfYear(1);
            default -> {
                return Optional.empty();
            }
        }
        return Optional.of(start.atStartOfDay(zone).toInstant());
    }

    public boolean isDue(Instant lastUsedAt, Instant now, ZoneId zone) {
        if (lastUsedAt == null) {
            return false;
        }
        return periodStart(now, zone)
                .map(lastUsedAt::isBefore)
                .orElse(false);
    }

    public Optional<Instant> nextReset(Instant now, ZoneId zone) {
        return periodStart(now, zone).map(start -> {
            ZonedDateTime zoned = start.atZone(zone);
            return switch (this) {
                case DAILY -> zoned.plusDays(1).toInstant();
                case MONTHLY -> zoned.plusMonths(1).toInstant();
                default -> zoned.plusYears(1).toInstant();
            };
        });
    }
}
