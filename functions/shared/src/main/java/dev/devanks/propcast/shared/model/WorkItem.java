package dev.devanks.propcast.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One unit of prediction work: a single entity for one batch.
 * Published by the coordinator and pushed to the worker at-least-once.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkItem {
    private String entityId;
    private String batchId;
    private LocalDate date;
    private String systemId;
    private int attempt;
    private Instant enqueuedAt;
    // Line known when the batch was built; null when the line source had none
    private Double referenceLine;
    private Instant lineCapturedAt;
}
