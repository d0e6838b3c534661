package dev.devanks.propcast.coordinator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One participant scheduled on the requested date, as returned by the entity universe service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UniverseEntity {
    @JsonAlias({"player_lookup", "entity_id"})
    private String entityId;
    @JsonAlias("game_id")
    private String eventId;
    private String team;
}
