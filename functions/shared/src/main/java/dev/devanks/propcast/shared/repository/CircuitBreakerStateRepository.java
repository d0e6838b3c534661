package dev.devanks.propcast.shared.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.shared.entity.CircuitBreakerStateEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface CircuitBreakerStateRepository extends FirestoreReactiveRepository<CircuitBreakerStateEntity> {
}
