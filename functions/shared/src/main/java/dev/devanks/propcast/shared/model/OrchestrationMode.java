package dev.devanks.propcast.shared.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * Completeness policy for a processing date. Each mode maps to its own required producer set.
 */
public enum OrchestrationMode {
    /** Overnight run over a finished date; every producer is expected. */
    FULL("overnight"),
    /** Same-day incremental run. */
    PARTIAL_A("same_day"),
    /** Next-day preparation run. */
    PARTIAL_B("tomorrow");

    private final String legacyName;

    OrchestrationMode(String legacyName) {
        this.legacyName = legacyName;
    }

    /**
     * Accepts the enum name in any case, with dashes or underscores, or the producer-side
     * names {@code overnight}, {@code same_day} and {@code tomorrow}.
     */
    public static Optional<OrchestrationMode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (OrchestrationMode mode : values()) {
            if (mode.name().toLowerCase(Locale.ROOT).equals(normalized) || mode.legacyName.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    /**
     * Mode implied by where the processing date sits relative to today: a past date is an overnight run,
     * today a same-day run, a future date a next-day run.
     */
    public static OrchestrationMode detect(LocalDate date, LocalDate today) {
        if (date.isBefore(today)) {
            return FULL;
        }
        return date.isEqual(today) ? PARTIAL_A : PARTIAL_B;
    }
}
