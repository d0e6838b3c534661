package dev.devanks.propcast.orchestrator.model;

import dev.devanks.propcast.shared.model.OrchestrationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body posted to the next stage's entry point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageTriggerRequest {
    private String stage;
    private String nextStage;
    private String date;
    private OrchestrationMode mode;
    private int attempt;
    private String triggerReason;
}
