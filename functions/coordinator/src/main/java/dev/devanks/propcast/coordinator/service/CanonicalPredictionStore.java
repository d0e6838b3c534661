// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/service/CanonicalPredictionStore.java
package dev.devanks.propcast.coordinator.service;

import dev.devanks.propcast.coordinator.entity.ActivePredictionPointerEntity;
import dev.devanks.propcast.coordinator.entity.PredictionRecordEntity;
import dev.devanks.propcast.coordinator.model.MergeSummary;
import dev.devanks.propcast.coordinator.repository.ActivePredictionPointerRepository;
import dev.devanks.propcast.coordinator.repository.PredictionRecordRepository;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical prediction store. {@link #mergeActive(List)} is the only write path to the active flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CanonicalPredictionStore {

    private final PredictionRecordRepository recordRepository;
    private final ActivePredictionPointerRepository pointerRepository;
    private final FirestoreTransactions transactions;
    private final Clock clock;

    /**
     * Makes the best record of each (date, system, entity) key active and supersedes every other record of that key,
     * including the previously active one. Each key is merged in its own transaction that reads and rewrites the key's
     * pointer document. Calling it again with the same input changes nothing.
     *
     * @param candidates records to merge; several may share a key
     * @return counts over all keys
     */
    public Mono<MergeSummary> mergeActive(List<PredictionRecordEntity> candidates) {
        Map<String, List<PredictionRecordEntity>> byKey = new LinkedHashMap<>();
        for (PredictionRecordEntity candidate : candidates) {
            byKey.computeIfAbsent(candidate.predictionKey(), k -> new ArrayList<>()).add(candidate);
        }
        return Flux.fromIterable(byKey.entrySet())
                .concatMap(entry -> mergeKey(entry.getKey(), entry.getValue()))
                .reduce(new MergeSummary(), MergeSummary::plus);
    }

    private Mono<MergeSummary> mergeKey(String key, List<PredictionRecordEntity> candidates) {
        List<String> candidateIds = candidates.stream().map(PredictionRecordEntity::getId).distinct().toList();
        return transactions.inTransaction("merge:" + key, () -> pointerRepository.findById(key)
                .defaultIfEmpty(ActivePredictionPointerEntity.builder().id(key).build())
                .flatMap(pointer -> {
                    List<String> ids = new ArrayList<>(candidateIds);
                    if (pointer.getActiveRecordId() != null && !ids.contains(pointer.getActiveRecordId())) {
                        ids.add(pointer.getActiveRecordId());
                    }
                    return recordRepository.findAllById(ids).collectList()
                            .flatMap(stored -> applyMerge(key, pointer, candidates, stored));
                }));
    }

    private Mono<MergeSummary> applyMerge(String key, ActivePredictionPointerEntity pointer,
                                          List<PredictionRecordEntity> candidates, List<PredictionRecordEntity> stored) {
        Instant now = clock.instant();
        Map<String, PredictionRecordEntity> storedById = new LinkedHashMap<>();
        stored.forEach(record -> storedById.put(record.getId(), record));

        // Stored copies keep their audit fields; new candidates enter as they are
        Map<String, PredictionRecordEntity> pool = new LinkedHashMap<>(storedById);
        candidates.forEach(candidate -> pool.putIfAbsent(candidate.getId(), candidate));

        PredictionRecordEntity winner = pool.values().stream().max(PredictionSnapshotRanking.WORST_TO_BEST).orElseThrow();
        String previousActive = pointer.getActiveRecordId();

        List<PredictionRecordEntity> writes = new ArrayList<>();
        int supersededNow = 0;
        for (PredictionRecordEntity record : pool.values()) {
            boolean isWinner = record.getId().equals(winner.getId());
            boolean stale = !storedById.containsKey(record.getId());
            if (isWinner) {
                if (stale || !record.isActive() || record.getSupersededBy() != null) {
                    writes.add(record.toBuilder().active(true).supersededBy(null).supersededAt(null)
                            .consolidatedAt(now).build());
                }
            } else if (stale || record.isActive() || !winner.getId().equals(record.getSupersededBy())) {
                if (record.isActive()) {
                    supersededNow++;
                }
                writes.add(record.toBuilder().active(false).supersededBy(winner.getId()).supersededAt(now)
                        .consolidatedAt(record.getConsolidatedAt() == null ? now : record.getConsolidatedAt()).build());
            }
        }

        boolean pointerChanges = !Objects.equals(previousActive, winner.getId());
        if (writes.isEmpty() && !pointerChanges) {
            return Mono.just(new MergeSummary(1, 0, 0, 1));
        }
        if (pointerChanges) {
            log.info("Active prediction for {} moves from {} to {}", key, previousActive, winner.getId());
        }
        ActivePredictionPointerEntity updatedPointer = pointer.toBuilder().activeRecordId(winner.getId()).updatedAt(now).build();
        return recordRepository.saveAll(writes).then(pointerRepository.save(updatedPointer))
                .thenReturn(new MergeSummary(1, pointerChanges ? 1 : 0, supersededNow, pointerChanges ? 0 : 1));
    }

    /**
     * Active records for a (date, system), as consumers see them.
     */
    public Flux<PredictionRecordEntity> activeRecords(String gameDate, String systemId) {
        return recordRepository.findByGameDateAndSystemIdAndActive(gameDate, systemId, true);
    }
}
