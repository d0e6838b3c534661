package dev.devanks.propcast.orchestrator.config;

import dev.devanks.propcast.shared.model.OrchestrationMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    @Data
    @Validated
    public static class StageProperties {
        /**
         * Every producer that reports completion for this stage.
         */
        @NotEmpty
        private List<String> producers = List.of();

        /**
         * Producers that must have completed before the next stage starts, per mode.
         * A mode missing here requires the full producer list.
         */
        private Map<OrchestrationMode, List<String>> requiredByMode = new EnumMap<>(OrchestrationMode.class);

        @NotEmpty
        private String nextStage;

        @NotEmpty
        @URL
        private String nextStageUrl;
    }

    @Data
    @Validated
    public static class TriggerProperties {
        /**
         * Failed invocations, each from a distinct signal, before the record moves to TRIGGER_FAILED.
         */
        @Positive
        private int maxAttempts = 3;

        /**
         * How long a claimed invocation blocks concurrent signals from invoking again.
         */
        @NotNull
        private Duration attemptLease = Duration.ofMinutes(2);

        @NotNull
        private Duration invocationTimeout = Duration.ofSeconds(60);

        /**
         * Attach a Google-signed ID token for the next stage's URL.
         */
        private boolean authenticate = true;
    }

    /**
     * Zone that defines "today" for mode detection.
     */
    @NotNull
    private ZoneId zone = ZoneId.of("America/New_York");

    @Valid
    @NotNull
    private TriggerProperties trigger = new TriggerProperties();

    @Valid
    private Map<String, StageProperties> stages = new LinkedHashMap<>();
}
