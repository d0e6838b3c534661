package dev.devanks.propcast.coordinator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of {@code POST /start}. Also accepts the trigger posted by the stage orchestrator, whose extra fields are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StartBatchRequest {
    @NotNull
    @JsonAlias("game_date")
    private LocalDate date;
    private String systemId; // all configured systems when absent
    private String mode;
}
