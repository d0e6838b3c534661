// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/entity/WorkBatchEntity.java
package dev.devanks.propcast.coordinator.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.propcast.coordinator.model.BatchStatus;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "prediction_batches")
public class WorkBatchEntity {

    @DocumentId
    private String batchId; // batch_{date}_{systemId}_{epochSeconds}
    private String gameDate;
    private String systemId;
    private OrchestrationMode mode;
    private BatchStatus status;

    @Builder.Default
    private List<String> entityIds = new ArrayList<>();
    // Lines captured while the batch was built, keyed by entity id
    @Builder.Default
    private Map<String, Double> referenceLines = new HashMap<>();
    private Instant linesCapturedAt;

    @Builder.Default
    private List<String> dispatchedEntityIds = new ArrayList<>();
    private int dispatchedCount;
    private int dispatchAttempts;

    @Builder.Default
    private List<String> completedEntityIds = new ArrayList<>();
    @Builder.Default
    private List<String> skippedEntityIds = new ArrayList<>();
    private int resultCount;

    @Builder.Default
    private List<String> excludedEntityIds = new ArrayList<>(); // circuit-broken at build time
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant consolidatedAt;

    public static String idFor(String gameDate, String systemId, Instant createdAt) {
        return "batch_" + gameDate + "_" + systemId + "_" + createdAt.getEpochSecond();
    }
}
