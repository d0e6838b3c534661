package dev.devanks.propcast.coordinator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReferenceLine {
    @JsonAlias({"player_lookup", "entity_id"})
    private String entityId;
    @JsonAlias({"points_line", "current_line"})
    private Double line;
    @JsonAlias("bookmaker")
    private String source;
    @JsonAlias("snapshot_timestamp")
    private Instant capturedAt;
}
