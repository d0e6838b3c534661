package dev.devanks.propcast.orchestrator.model;

public enum TriggerAction {
    /** This signal claimed the invocation and must call the next stage. */
    INVOKE,
    /** Required producers still missing. */
    WAIT,
    /** Another signal holds an unexpired invocation lease. */
    IN_FLIGHT,
    /** Next stage already started for this window. */
    ALREADY_TRIGGERED
}
