package dev.devanks.propcast.worker.service;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import dev.devanks.propcast.worker.config.WorkerProperties;
import dev.devanks.propcast.worker.model.ExecutionLogEntry;
import dev.devanks.propcast.worker.model.SkipReason;
import dev.devanks.propcast.worker.model.WorkOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionLogWriterTest {

    @Mock
    private BigQuery bigQuery;
    @Spy
    private WorkerProperties properties = new WorkerProperties();

    @InjectMocks
    private ExecutionLogWriter writer;

    @Captor
    private ArgumentCaptor<InsertAllRequest> requestCaptor;

    private ExecutionLogEntry entry;

    @BeforeEach
    void setUp() {
        entry = ExecutionLogEntry.builder()
                .entityId("e1")
                .batchId("batch-1")
                .systemId("ensemble_v1")
                .gameDate("2025-01-15")
                .attempt(2)
                .outcome(WorkOutcome.SKIPPED)
                .skipReason(SkipReason.TOO_MANY_DEFAULTS)
                .qualityScore(61.5)
                .defaultFeatures(List.of("pace_score", "days_rest"))
                .workerId("worker-00042")
                .durationMs(87)
                .loggedAt(Instant.parse("2025-01-15T17:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should always write list columns as arrays, empty when the entry has none")
    void toRow_listsNeverNull() {
        Map<String, Object> row = writer.toRow(entry);

        assertThat(row.get("default_features")).isEqualTo(List.of("pace_score", "days_rest"));
        assertThat(row.get("contaminated_features")).isEqualTo(List.of());
        assertThat(row.get("critical_defaults")).isEqualTo(List.of());
        assertThat(row).containsEntry("outcome", "SKIPPED")
                .containsEntry("skip_reason", "TOO_MANY_DEFAULTS")
                .containsEntry("logged_at", "2025-01-15T17:00:00Z")
                .doesNotContainKey("staging_id")
                .doesNotContainKey("error_message");
    }

    @Test
    @DisplayName("Should stream the row into the configured table")
    void write_insertsRow() {
        InsertAllResponse response = mock(InsertAllResponse.class);
        when(response.hasErrors()).thenReturn(false);
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(response);

        StepVerifier.create(writer.write(entry)).verifyComplete();

        verify(bigQuery).insertAll(requestCaptor.capture());
        InsertAllRequest request = requestCaptor.getValue();
        assertThat(request.getTable().getDataset()).isEqualTo("propcast_orchestration");
        assertThat(request.getTable().getTable()).isEqualTo("worker_execution_log");
        assertThat(request.getRows()).hasSize(1);
        assertThat(request.getRows().get(0).getContent()).containsEntry("entity_id", "e1");
    }

    @Test
    @DisplayName("Should complete without error when BigQuery rejects the row or is unreachable")
    void write_failures_swallowed() {
        InsertAllResponse rejected = mock(InsertAllResponse.class);
        when(rejected.hasErrors()).thenReturn(true);
        when(rejected.getInsertErrors()).thenReturn(Map.of(0L, List.of(new BigQueryError("invalid", "default_features", "null"))));
        when(bigQuery.insertAll(any(InsertAllRequest.class)))
                .thenReturn(rejected)
                .thenThrow(new BigQueryException(503, "backend error"));

        StepVerifier.create(writer.write(entry)).verifyComplete();
        StepVerifier.create(writer.write(entry)).verifyComplete();
    }

    @Test
    @DisplayName("Should not call BigQuery when the execution log is disabled")
    void write_disabled_noop() {
        properties.getExecutionLog().setEnabled(false);

        StepVerifier.create(writer.write(entry)).verifyComplete();

        verifyNoInteractions(bigQuery);
    }
}
