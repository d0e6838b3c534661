package dev.devanks.propcast.shared.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.shared.entity.StagedPredictionEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface StagedPredictionRepository extends FirestoreReactiveRepository<StagedPredictionEntity> {

    Flux<StagedPredictionEntity> findByGameDateAndSystemId(String gameDate, String systemId);
}
