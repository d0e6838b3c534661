package dev.devanks.propcast.worker.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.worker.entity.FeatureVectorEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface FeatureVectorRepository extends FirestoreReactiveRepository<FeatureVectorEntity> {
}
