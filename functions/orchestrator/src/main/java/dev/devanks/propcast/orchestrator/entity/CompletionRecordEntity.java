package dev.devanks.propcast.orchestrator.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import dev.devanks.propcast.orchestrator.model.TriggerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "stage_completions")
public class CompletionRecordEntity {

    @DocumentId
    private String id; // {stage}_{date}
    private String stage;
    private String date;
    private OrchestrationMode mode; // fixed at creation
    @Builder.Default
    private List<String> requiredProducers = new ArrayList<>();
    @Builder.Default
    private List<String> completedProducers = new ArrayList<>();
    private TriggerState triggerState;
    private int triggerAttempts;
    private Instant attemptLeaseUntil;
    private String lastTriggerError;
    private Instant triggeredAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static String idFor(String stage, String date) {
        return stage + "_" + date;
    }
}
