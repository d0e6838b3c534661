// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/entity/ActivePredictionPointerEntity.java
package dev.devanks.propcast.coordinator.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One document per (date, system, entity) naming the active prediction. Every active-record flip reads and
 * writes this document in the same transaction, so concurrent consolidations of one key conflict and retry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "active_predictions")
public class ActivePredictionPointerEntity {

    @DocumentId
    private String id;
    private String activeRecordId;
    private Instant updatedAt;

    public static String idFor(String gameDate, String systemId, String entityId) {
        return gameDate + "_" + systemId + "_" + entityId;
    }
}
