package dev.devanks.propcast.worker.model;

/**
 * Why a work item produced no prediction. Retryable reasons are redelivered by the queue; permanent ones are
 * acknowledged. Only failures caused by the entity's own data count against its circuit breaker.
 */
public enum SkipReason {
    STALE_DATE(false, false),
    INVALID_SCHEMA(false, false),
    QUALITY_BELOW_FLOOR(false, false),
    TOO_MANY_DEFAULTS(false, false),
    CRITICAL_FEATURE_DEFAULT(false, false),
    CIRCUIT_OPEN(false, false),

    FEATURES_NOT_READY(true, true),
    TRANSIENT_READ_ERROR(true, true),
    SCORING_FAILED(true, false),
    STAGING_WRITE_FAILED(true, false),
    COMPLETION_PUBLISH_FAILED(true, false);

    private final boolean retryable;
    private final boolean countsAgainstBreaker;

    SkipReason(boolean retryable, boolean countsAgainstBreaker) {
        this.retryable = retryable;
        this.countsAgainstBreaker = countsAgainstBreaker;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean countsAgainstBreaker() {
        return countsAgainstBreaker;
    }
}
