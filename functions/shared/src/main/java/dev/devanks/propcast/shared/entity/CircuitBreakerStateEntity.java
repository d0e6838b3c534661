package dev.devanks.propcast.shared.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "entity_circuit_breakers")
public class CircuitBreakerStateEntity {

    @DocumentId
    private String entityId;
    private int consecutiveFailures;
    private Instant trippedUntil; // null while closed
    private String lastFailureReason;
    private Instant lastFailureAt;
    private Instant updatedAt;
}
