// functions/worker/src/main/java/dev/devanks/propcast/worker/service/ExecutionLogWriter.java
package dev.devanks.propcast.worker.service;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.TableId;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.worker.config.WorkerProperties;
import dev.devanks.propcast.worker.model.ExecutionLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams one execution log row per processed work item. Best effort: a failed log write never fails the item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionLogWriter {

    private final BigQuery bigQuery;
    private final WorkerProperties properties;

    public Mono<Void> write(ExecutionLogEntry entry) {
        WorkerProperties.ExecutionLogProperties logProperties = properties.getExecutionLog();
        if (!logProperties.isEnabled()) {
            return Mono.empty();
        }
        TableId table = TableId.of(logProperties.getDataset(), logProperties.getTable());
        return Mono.fromCallable(() -> bigQuery.insertAll(InsertAllRequest.newBuilder(table).addRow(toRow(entry)).build()))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(response -> {
                    if (response.hasErrors()) {
                        log.warn("Execution log row for {} rejected: {}", entry.getEntityId(), response.getInsertErrors());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Execution log write for {} failed: {}", entry.getEntityId(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * REPEATED columns are always arrays; BigQuery rejects the whole row for a null one.
     */
    @VisibleForTesting
    Map<String, Object> toRow(ExecutionLogEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("entity_id", entry.getEntityId());
        row.put("batch_id", entry.getBatchId());
        row.put("system_id", entry.getSystemId());
        row.put("game_date", entry.getGameDate());
        row.put("attempt", entry.getAttempt());
        row.put("outcome", entry.getOutcome() == null ? null : entry.getOutcome().name());
        row.put("skip_reason", entry.getSkipReason() == null ? null : entry.getSkipReason().name());
        row.put("quality_score", entry.getQualityScore());
        row.put("default_features", orEmpty(entry.getDefaultFeatures()));
        row.put("contaminated_features", orEmpty(entry.getContaminatedFeatures()));
        row.put("critical_defaults", orEmpty(entry.getCriticalDefaults()));
        row.put("model_file_name", entry.getModelFileName());
        row.put("staging_id", entry.getStagingId());
        row.put("error_message", entry.getErrorMessage());
        row.put("worker_id", entry.getWorkerId());
        row.put("duration_ms", entry.getDurationMs());
        row.put("logged_at", entry.getLoggedAt() == null ? null : entry.getLoggedAt().toString());
        row.values().removeIf(Objects::isNull);
        return row;
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
