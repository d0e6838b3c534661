package dev.devanks.propcast.coordinator.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.coordinator.entity.WorkBatchEntity;
import dev.devanks.propcast.coordinator.model.BatchStatus;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface WorkBatchRepository extends FirestoreReactiveRepository<WorkBatchEntity> {

    Flux<WorkBatchEntity> findByGameDateAndSystemId(String gameDate, String systemId);

    Flux<WorkBatchEntity> findByStatus(BatchStatus status);
}
