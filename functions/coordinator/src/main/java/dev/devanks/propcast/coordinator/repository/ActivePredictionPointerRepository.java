package dev.devanks.propcast.coordinator.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.coordinator.entity.ActivePredictionPointerEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface ActivePredictionPointerRepository extends FirestoreReactiveRepository<ActivePredictionPointerEntity> {
}
