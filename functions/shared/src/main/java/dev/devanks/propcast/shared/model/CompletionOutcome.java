package dev.devanks.propcast.shared.model;

public enum CompletionOutcome {
    PREDICTED,
    SKIPPED
}
