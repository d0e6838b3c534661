// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/client/ReferenceLineClient.java
package dev.devanks.propcast.coordinator.client;

import dev.devanks.propcast.coordinator.config.ExternalApiClientConfig;
import dev.devanks.propcast.coordinator.model.ReferenceLine;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Latest reference line per entity for a date. Read-only.
 */
@FeignClient(name = "reference-lines",
        url = "${coordinator.api.reference-line-url}",
        configuration = ExternalApiClientConfig.class)
public interface ReferenceLineClient {

    @GetMapping("/lines/latest")
    List<ReferenceLine> getLatestLines(@RequestParam("date") String date);
}
