package dev.devanks.propcast.coordinator.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StalledBatchReport {

    public enum Action {
        CONSOLIDATED_PARTIAL, REPORTED, MARKED_FAILED, MARKED_AWAITING_RESULTS
    }

    private String batchId;
    private BatchStatus status;
    private int dispatchedCount;
    private int resultCount;
    private double completionRatio;
    private Action action;
}
