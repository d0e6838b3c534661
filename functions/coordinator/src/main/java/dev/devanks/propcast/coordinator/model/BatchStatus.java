package dev.devanks.propcast.coordinator.model;

public enum BatchStatus {
    PENDING,
    DISPATCHING,
    AWAITING_RESULTS,
    CONSOLIDATED,
    FAILED;

    public boolean isInFlight() {
        return this == PENDING || this == DISPATCHING || this == AWAITING_RESULTS;
    }
}
