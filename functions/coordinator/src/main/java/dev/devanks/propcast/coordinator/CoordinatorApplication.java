// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/CoordinatorApplication.java
package dev.devanks.propcast.coordinator;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication(scanBasePackages = {"dev.devanks.propcast.coordinator", "dev.devanks.propcast.shared"})
@EnableFeignClients
@EnableReactiveFirestoreRepositories(basePackages = {"dev.devanks.propcast.coordinator.repository", "dev.devanks.propcast.shared.repository"})
public class CoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinatorApplication.class, args);
    }
}
