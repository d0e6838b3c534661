package dev.devanks.propcast.orchestrator.client;

import dev.devanks.propcast.orchestrator.config.NextStageClientConfig;
import dev.devanks.propcast.orchestrator.model.StageTriggerRequest;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.net.URI;

/**
 * Calls a stage's entry point. The target comes from the stage table, so every call passes its URI.
 */
@FeignClient(name = "next-stage",
        url = "${orchestrator.next-stage-base-url:http://localhost}",
        configuration = NextStageClientConfig.class)
public interface NextStageClient {

    @PostMapping
    void trigger(URI nextStageUrl, @RequestBody StageTriggerRequest request);
}
