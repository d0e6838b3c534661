package dev.devanks.propcast.orchestrator;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication(scanBasePackages = {"dev.devanks.propcast.orchestrator", "dev.devanks.propcast.shared"})
@EnableFeignClients
@EnableReactiveFirestoreRepositories(basePackages = {"dev.devanks.propcast.orchestrator.repository", "dev.devanks.propcast.shared.repository"})
public class OrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
