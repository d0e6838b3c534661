// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/mapper/PredictionRecordMapper.java
package dev.devanks.propcast.coordinator.mapper;

import dev.devanks.propcast.coordinator.entity.PredictionRecordEntity;
import dev.devanks.propcast.shared.entity.StagedPredictionEntity;
import org.springframework.stereotype.Component;

/**
 * Maps a staged worker row to the canonical record it may become. The canonical id is the staging id,
 * so consolidating the same staged row twice targets the same document.
 */
@Component
public class PredictionRecordMapper {

    public PredictionRecordEntity fromStaged(StagedPredictionEntity staged) {
        return PredictionRecordEntity.builder()
                .id(staged.getId())
                .entityId(staged.getEntityId())
                .gameDate(staged.getGameDate())
                .systemId(staged.getSystemId())
                .batchId(staged.getBatchId())
                .modelFileName(staged.getModelFileName())
                .modelVersion(staged.getModelVersion())
                .predictedValue(staged.getPredictedValue())
                .referenceLine(staged.getReferenceLine())
                .lineCapturedAt(staged.getLineCapturedAt())
                .recommendation(staged.getRecommendation())
                .confidence(staged.getConfidence())
                .qualityScore(staged.getQualityScore())
                .sampleQuality(staged.getSampleQuality())
                .createdAt(staged.getCreatedAt())
                .active(false)
                .build();
    }
}
