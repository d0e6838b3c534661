// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/service/StagingConsolidator.java
package dev.devanks.propcast.coordinator.service;

import dev.devanks.propcast.coordinator.entity.PredictionRecordEntity;
import dev.devanks.propcast.coordinator.mapper.PredictionRecordMapper;
import dev.devanks.propcast.coordinator.model.ConsolidationResult;
import dev.devanks.propcast.shared.alert.AlertType;
import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.repository.StagedPredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges every staged row of a (date, system) into the canonical store, then re-reads the active records
 * to verify at most one is active per entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StagingConsolidator {

    private final StagedPredictionRepository stagingRepository;
    private final PredictionRecordMapper mapper;
    private final CanonicalPredictionStore store;
    private final OperationalAlerts alerts;

    /**
     * Staged rows are never deleted, so re-running after a partial failure or a reset picks everything up again.
     *
     * @param batchId  batch the consolidation runs for, used in logs and the result
     * @param gameDate processing date
     * @param systemId scoring system
     */
    public Mono<ConsolidationResult> consolidate(String batchId, String gameDate, String systemId) {
        log.info("Consolidating staged predictions for {} {} (batch {})", gameDate, systemId, batchId);
        return stagingRepository.findByGameDateAndSystemId(gameDate, systemId)
                .map(mapper::fromStaged)
                .collectList()
                .flatMap(candidates -> store.mergeActive(candidates)
                        .map(summary -> ConsolidationResult.builder()
                                .batchId(batchId)
                                .date(gameDate)
                                .systemId(systemId)
                                .stagedRows(candidates.size())
                                .keys(summary.getKeys())
                                .activated(summary.getActivated())
                                .superseded(summary.getSuperseded())
                                .unchanged(summary.getUnchanged())
                                .build()))
                .flatMap(result -> duplicateActiveKeys(gameDate, systemId)
                        .map(duplicates -> result.toBuilder().duplicateActiveKeys(duplicates).build()))
                .doOnSuccess(result -> log.info("Consolidation of {} {} done: {}", gameDate, systemId, result))
                .doOnError(e -> log.error("Consolidation of {} {} failed: {}", gameDate, systemId, e.getMessage(), e));
    }

    private Mono<Integer> duplicateActiveKeys(String gameDate, String systemId) {
        return store.activeRecords(gameDate, systemId)
                .collectList()
                .map(active -> {
                    Map<String, List<String>> idsByEntity = active.stream().collect(Collectors.groupingBy(
                            PredictionRecordEntity::getEntityId,
                            Collectors.mapping(PredictionRecordEntity::getId, Collectors.toList())));
                    var duplicates = idsByEntity.entrySet().stream().filter(e -> e.getValue().size() > 1).toList();
                    duplicates.forEach(e -> alerts.raise(AlertType.DUPLICATE_ACTIVE,
                            "More than one active prediction after consolidation",
                            Map.of("date", gameDate, "systemId", systemId, "entityId", e.getKey(), "activeIds", e.getValue())));
                    return duplicates.size();
                });
    }
}
