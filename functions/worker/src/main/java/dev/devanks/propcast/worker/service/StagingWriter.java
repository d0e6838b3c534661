package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.entity.StagedPredictionEntity;
import dev.devanks.propcast.shared.repository.StagedPredictionRepository;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Writes one staging row per delivery attempt. A redelivery of the same attempt finds its row and keeps it,
 * so the first write's createdAt survives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StagingWriter {

    private final StagedPredictionRepository repository;
    private final FirestoreTransactions transactions;

    public Mono<StagedPredictionEntity> write(StagedPredictionEntity row) {
        return transactions.inTransaction("stage:" + row.getId(), () -> repository.findById(row.getId())
                .doOnNext(existing -> log.info("Staging row {} already written at {}", existing.getId(), existing.getCreatedAt()))
                .switchIfEmpty(Mono.defer(() -> repository.save(row))));
    }
}
