package dev.devanks.propcast.worker.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class WorkResult {
    private WorkOutcome outcome;
    private SkipReason reason; // null when predicted
    private String detail;
    private String stagingId;
    private String modelFileName;
    private QualityVerdict verdict; // null when the gate never ran

    public static WorkResult skipped(WorkOutcome outcome, SkipReason reason, String detail) {
        return WorkResult.builder().outcome(outcome).reason(reason).detail(detail).build();
    }
}
