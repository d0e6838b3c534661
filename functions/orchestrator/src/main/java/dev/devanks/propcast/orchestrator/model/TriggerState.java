package dev.devanks.propcast.orchestrator.model;

/**
 * Two-phase trigger guard. {@code READY_PENDING} records the decision to invoke the next stage,
 * {@code TRIGGERED} is only written after that invocation returned successfully.
 */
public enum TriggerState {
    WAITING,
    READY_PENDING,
    TRIGGERED,
    TRIGGER_FAILED
}
