package dev.devanks.propcast.coordinator.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.coordinator.entity.PredictionRecordEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface PredictionRecordRepository extends FirestoreReactiveRepository<PredictionRecordEntity> {

    Flux<PredictionRecordEntity> findByGameDateAndSystemIdAndActive(String gameDate, String systemId, boolean active);
}
