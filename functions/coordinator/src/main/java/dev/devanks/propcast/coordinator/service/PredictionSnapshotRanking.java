package dev.devanks.propcast.coordinator.service;

import dev.devanks.propcast.coordinator.entity.PredictionRecordEntity;

import java.time.Instant;
import java.util.Comparator;

/**
 * Orders candidate records for one key from worst to best: a record made against a reference line beats one made
 * without, then the newer line snapshot wins, then the later {@code createdAt}, then the greater id.
 * The order is total, so every consolidation run picks the same winner from the same candidates.
 * <p>
 * Line presence and snapshot age rank above {@code createdAt}: a later retry scored without a line
 * must not displace a prediction made against one. Candidates that agree on both stay last-write-wins by
 * {@code createdAt}.
 */
final class PredictionSnapshotRanking {

    static final Comparator<PredictionRecordEntity> WORST_TO_BEST = Comparator
            .comparing((PredictionRecordEntity r) -> r.getReferenceLine() != null)
            .thenComparing(PredictionRecordEntity::getLineCapturedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(PredictionRecordEntity::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(PredictionRecordEntity::getId);

    private PredictionSnapshotRanking() {
    }
}
