// functions/worker/src/main/java/dev/devanks/propcast/worker/entity/FeatureVectorEntity.java
package dev.devanks.propcast.worker.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.propcast.shared.model.SampleQuality;
import dev.devanks.propcast.worker.model.FeatureSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Feature vector written by the upstream feature stage. Read-only here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "ml_feature_store")
public class FeatureVectorEntity {

    @DocumentId
    private String id; // {gameDate}_{entityId}
    private String entityId;
    private String gameDate;

    // Parallel to the configured feature names; a value is null only where its source is DEFAULT
    @Builder.Default
    private List<Double> values = new ArrayList<>();
    @Builder.Default
    private List<FeatureSource> sources = new ArrayList<>();

    private Double qualityScore;
    private SampleQuality sampleQuality;
    // Rolling window behind the windowed features: requested size and events actually found
    private Integer windowSize;
    private Integer windowUsed;
    private Instant computedAt;

    public static String idFor(String gameDate, String entityId) {
        return gameDate + "_" + entityId;
    }
}
