package dev.devanks.propcast.worker.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * One row of the worker execution log. List fields map to REPEATED columns.
 */
@Data
@Builder
public class ExecutionLogEntry {
    private String entityId;
    private String batchId;
    private String systemId;
    private String gameDate;
    private int attempt;
    private WorkOutcome outcome;
    private SkipReason skipReason;
    private Double qualityScore;
    private List<String> defaultFeatures;
    private List<String> contaminatedFeatures;
    private List<String> criticalDefaults;
    private String modelFileName;
    private String stagingId;
    private String errorMessage;
    private String workerId;
    private long durationMs;
    private Instant loggedAt;
}
