package dev.devanks.propcast.orchestrator.model;

import dev.devanks.propcast.orchestrator.entity.CompletionRecordEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Set;

/**
 * Outcome of applying one completion signal to its record: what the caller must do next,
 * the record as committed, and the required producers still missing.
 */
@Data
@AllArgsConstructor
public class CompletionDecision {
    private TriggerAction action;
    private CompletionRecordEntity record;
    private Set<String> missing;
}
