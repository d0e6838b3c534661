package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.entity.StagedPredictionEntity;
import dev.devanks.propcast.shared.repository.StagedPredictionRepository;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StagingWriterTest {

    @Mock
    private StagedPredictionRepository repository;
    @Mock
    private TransactionalOperator transactionalOperator;

    private final Map<String, StagedPredictionEntity> rows = new HashMap<>();
    private StagingWriter writer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lenient().when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(repository.findById(anyString()))
                .thenAnswer(inv -> Mono.fromSupplier(() -> rows.get(inv.<String>getArgument(0))));
        lenient().when(repository.save(any(StagedPredictionEntity.class))).thenAnswer(inv -> {
            StagedPredictionEntity row = inv.getArgument(0);
            rows.put(row.getId(), row);
            return Mono.just(row);
        });
        writer = new StagingWriter(repository, new FirestoreTransactions(transactionalOperator));
    }

    private StagedPredictionEntity row(double predicted, Instant createdAt) {
        return StagedPredictionEntity.builder()
                .id(StagedPredictionEntity.idFor("batch-1", "ensemble_v1", "e1", 1))
                .batchId("batch-1")
                .entityId("e1")
                .gameDate("2025-01-15")
                .systemId("ensemble_v1")
                .attempt(1)
                .predictedValue(predicted)
                .createdAt(createdAt)
                .build();
    }

    @Test
    @DisplayName("Should write a new staging row")
    void write_new_saved() {
        StepVerifier.create(writer.write(row(27.7, Instant.parse("2025-01-15T17:00:00Z"))))
                .assertNext(saved -> assertThat(saved.getId()).isEqualTo("batch-1_ensemble_v1_e1_a1"))
                .verifyComplete();

        assertThat(rows).containsKey("batch-1_ensemble_v1_e1_a1");
    }

    @Test
    @DisplayName("Should keep the first row when the same attempt is redelivered")
    void write_redelivery_keepsFirst() {
        Instant first = Instant.parse("2025-01-15T17:00:00Z");
        writer.write(row(27.7, first)).block();

        StepVerifier.create(writer.write(row(27.9, first.plusSeconds(40))))
                .assertNext(kept -> {
                    assertThat(kept.getCreatedAt()).isEqualTo(first);
                    assertThat(kept.getPredictedValue()).isEqualTo(27.7);
                })
                .verifyComplete();

        verify(repository, times(1)).save(any(StagedPredictionEntity.class));
    }
}
