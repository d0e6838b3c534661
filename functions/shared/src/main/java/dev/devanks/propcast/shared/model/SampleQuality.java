package dev.devanks.propcast.shared.model;

/**
 * How much real history backed a statistic computed over a rolling window.
 * The tier is always relative to the window size, never to the raw count alone.
 */
public enum SampleQuality {
    EXCELLENT,
    GOOD,
    LIMITED,
    INSUFFICIENT;

    /**
     * Classifies a window where {@code used} qualifying events were found out of the {@code window} requested.
     * Thresholds are compared in integer arithmetic: {@code used/window >= 0.7} becomes {@code used*10 >= window*7}.
     *
     * @param used   number of qualifying historical events actually found
     * @param window window size the statistic asked for
     * @return the tier
     */
    public static SampleQuality of(int used, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got " + window);
        }
        if (used < 0) {
            throw new IllegalArgumentException("Used count must not be negative, got " + used);
        }
        long scaledUsed = (long) used * 10;
        if (used >= window) {
            return EXCELLENT;
        }
        if (scaledUsed >= (long) window * 7) {
            return GOOD;
        }
        if (scaledUsed >= (long) window * 5) {
            return LIMITED;
        }
        return INSUFFICIENT;
    }
}
