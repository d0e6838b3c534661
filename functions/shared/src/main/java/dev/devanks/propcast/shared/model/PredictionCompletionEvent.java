package dev.devanks.propcast.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Emitted by a worker once it has finished with a work item, so the coordinator can track batch progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionCompletionEvent {
    private String batchId;
    private String entityId;
    private String systemId;
    private String date;
    private CompletionOutcome outcome;
    private String skipReason; // Only populated for SKIPPED
    private String stagingId;  // Only populated for PREDICTED
    private String workerId;
    private Instant completedAt;
}
