package dev.devanks.propcast.orchestrator.model;

import dev.devanks.propcast.shared.model.OrchestrationMode;
import lombok.Builder;
import lombok.Data;

/**
 * Summary of one completion signal's handling, returned by the function.
 */
@Data
@Builder
public class OrchestrationResult {
    private String stage;
    private String date;
    private OrchestrationMode mode;
    private TriggerAction action;
    private TriggerState triggerState;
    private String detail;

    public String toSummary() {
        return String.format("stage=%s date=%s mode=%s action=%s state=%s%s", stage, date, mode, action, triggerState,
                detail == null ? "" : " detail=" + detail);
    }
}
