package dev.devanks.propcast.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.devanks.propcast.coordinator.entity.WorkBatchEntity;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchStatusResponse {
    private String batchId;
    private String date;
    private String systemId;
    private OrchestrationMode mode;
    private BatchStatus status;
    private int entityCount;
    private int excludedCount;
    private int dispatchedCount;
    private int resultCount;
    private int predictedCount;
    private int skippedCount;
    private double completionRatio;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant consolidatedAt;

    public static BatchStatusResponse from(WorkBatchEntity batch) {
        int dispatched = batch.getDispatchedCount();
        return BatchStatusResponse.builder()
                .batchId(batch.getBatchId())
                .date(batch.getGameDate())
                .systemId(batch.getSystemId())
                .mode(batch.getMode())
                .status(batch.getStatus())
                .entityCount(batch.getEntityIds().size())
                .excludedCount(batch.getExcludedEntityIds().size())
                .dispatchedCount(dispatched)
                .resultCount(batch.getResultCount())
                .predictedCount(batch.getCompletedEntityIds().size())
                .skippedCount(batch.getSkippedEntityIds().size())
                .completionRatio(dispatched == 0 ? 0.0 : (double) batch.getResultCount() / dispatched)
                .failureReason(batch.getFailureReason())
                .createdAt(batch.getCreatedAt())
                .updatedAt(batch.getUpdatedAt())
                .consolidatedAt(batch.getConsolidatedAt())
                .build();
    }
}
