package dev.devanks.propcast.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Identifies a batch either by id or by (date, systemId); used by reset, consolidate and retry-dispatch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchRef {
    private String batchId;
    private LocalDate date;
    private String systemId;

    public static BatchRef ofId(String batchId) {
        return new BatchRef(batchId, null, null);
    }
}
