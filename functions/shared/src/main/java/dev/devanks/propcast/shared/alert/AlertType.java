package dev.devanks.propcast.shared.alert;

public enum AlertType {
    /** Next-stage invocation kept failing across distinct completion signals. */
    TRIGGER_FAILED,
    /** A default-sourced feature carried a sentinel value instead of null. */
    CONTAMINATION,
    /** More than one active prediction found for one key after consolidation. */
    DUPLICATE_ACTIVE,
    /** Work item publishing stopped partway through a batch. */
    DISPATCH_INTERRUPTED,
    /** An entity's circuit breaker tripped. */
    CIRCUIT_TRIPPED,
    /** A batch stopped receiving results below the partial-consolidation ratio. */
    BATCH_STALLED
}
