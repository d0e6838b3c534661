package dev.devanks.propcast.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Published by a stage producer when it finished its share of a processing date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompletionSignal {
    private String stage;
    @JsonAlias({"game_date", "analysis_date"})
    private LocalDate date;
    @JsonAlias({"producer_id", "processor_name"})
    private String producerId;
    private String mode; // Optional; detected from the date when absent or unrecognised
}
