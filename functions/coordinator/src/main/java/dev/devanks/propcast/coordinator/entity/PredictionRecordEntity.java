// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/entity/PredictionRecordEntity.java
package dev.devanks.propcast.coordinator.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.propcast.shared.model.Recommendation;
import dev.devanks.propcast.shared.model.SampleQuality;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Canonical prediction. Consumers only read records with {@code active = true}; superseded records are kept for audit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "predictions")
public class PredictionRecordEntity {

    @DocumentId
    private String id; // same id as the staged row it came from
    private String entityId;
    private String gameDate;
    private String systemId;
    private String batchId;

    private String modelFileName;
    private String modelVersion;
    private double predictedValue;
    private Double referenceLine;
    private Instant lineCapturedAt;
    private Recommendation recommendation;
    private double confidence;
    private double qualityScore;
    private SampleQuality sampleQuality;

    private boolean active;
    private String supersededBy;
    private Instant supersededAt;
    private Instant createdAt;
    private Instant consolidatedAt;

    public String predictionKey() {
        return ActivePredictionPointerEntity.idFor(gameDate, systemId, entityId);
    }
}
