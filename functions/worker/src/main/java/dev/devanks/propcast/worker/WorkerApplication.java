// functions/worker/src/main/java/dev/devanks/propcast/worker/WorkerApplication.java
package dev.devanks.propcast.worker;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"dev.devanks.propcast.worker", "dev.devanks.propcast.shared"})
@EnableReactiveFirestoreRepositories(basePackages = {"dev.devanks.propcast.worker.repository", "dev.devanks.propcast.shared.repository"})
public class WorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkerApplication.class, args);
    }
}
