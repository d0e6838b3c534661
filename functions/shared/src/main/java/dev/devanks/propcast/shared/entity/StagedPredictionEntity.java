package dev.devanks.propcast.shared.entity;

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
 * Worker output waiting for consolidation. One document per delivery attempt; redelivery of the
 * same attempt overwrites the same document. Consolidation dedups on (entity, date, system).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "prediction_staging")
public class StagedPredictionEntity {

    @DocumentId
    private String id;
    private String batchId;
    private String entityId;
    private String gameDate; // ISO yyyy-MM-dd, queried by the consolidator
    private String systemId;
    private int attempt;

    private String modelFileName;
    private String modelVersion;
    private double predictedValue;
    private Double referenceLine;
    private Instant lineCapturedAt;
    private Recommendation recommendation;
    private double confidence;
    private double qualityScore;
    private SampleQuality sampleQuality;
    private int defaultFeatureCount;

    private String workerId;
    private Instant createdAt;

    public static String idFor(String batchId, String systemId, String entityId, int attempt) {
        return batchId + "_" + systemId + "_" + entityId + "_a" + attempt;
    }

    /** Key on which staged rows are deduplicated and the canonical store keeps one active record. */
    public String predictionKey() {
        return gameDate + "_" + systemId + "_" + entityId;
    }
}
