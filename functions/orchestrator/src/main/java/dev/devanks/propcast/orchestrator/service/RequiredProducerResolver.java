package dev.devanks.propcast.orchestrator.service;

import dev.devanks.propcast.orchestrator.config.OrchestratorProperties;
import dev.devanks.propcast.orchestrator.config.OrchestratorProperties.StageProperties;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Turns the configured mode table into the producer set a record must see before the next stage may start.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequiredProducerResolver {

    private final OrchestratorProperties properties;
    private final Clock clock;

    public Optional<StageProperties> stage(String stage) {
        return Optional.ofNullable(stage).map(properties.getStages()::get);
    }

    /**
     * Required producers for the stage under the given mode. A mode with no entry in the table
     * falls back to the stage's full producer list.
     */
    public List<String> requiredProducers(String stageName, StageProperties stage, OrchestrationMode mode) {
        List<String> required = stage.getRequiredByMode().get(mode);
        if (required == null || required.isEmpty()) {
            log.warn("No required producer set configured for stage {} in mode {}; requiring all {} producers",
                    stageName, mode, stage.getProducers().size());
            return List.copyOf(stage.getProducers());
        }
        return List.copyOf(required);
    }

    /**
     * Mode from the signal when recognised, otherwise derived from the processing date.
     */
    public OrchestrationMode resolveMode(String requestedMode, LocalDate date) {
        return OrchestrationMode.parse(requestedMode).orElseGet(() -> {
            OrchestrationMode detected = detectMode(date);
            if (requestedMode != null && !requestedMode.isBlank()) {
                log.warn("Unrecognised mode '{}' for date {}; using detected mode {}", requestedMode, date, detected);
            }
            return detected;
        });
    }

    public OrchestrationMode detectMode(LocalDate date) {
        return OrchestrationMode.detect(date, LocalDate.now(clock.withZone(properties.getZone())));
    }
}
