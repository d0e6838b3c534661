package dev.devanks.propcast.coordinator.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class ConsolidationResult {
    private String batchId;
    private String date;
    private String systemId;
    private int stagedRows;
    private int keys;
    private int activated;
    private int superseded;
    private int unchanged;
    private int duplicateActiveKeys;
}
