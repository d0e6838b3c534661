// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/client/EntityUniverseClient.java
package dev.devanks.propcast.coordinator.client;

import dev.devanks.propcast.coordinator.config.ExternalApiClientConfig;
import dev.devanks.propcast.coordinator.model.UniverseEntity;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Entities scheduled to take part in events on a date.
 */
@FeignClient(name = "entity-universe",
        url = "${coordinator.api.entity-universe-url}",
        configuration = ExternalApiClientConfig.class)
public interface EntityUniverseClient {

    @GetMapping("/entities")
    List<UniverseEntity> getEntities(@RequestParam("date") String date);
}
