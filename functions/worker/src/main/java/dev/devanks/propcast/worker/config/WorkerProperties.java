// functions/worker/src/main/java/dev/devanks/propcast/worker/config/WorkerProperties.java
package dev.devanks.propcast.worker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    @Data
    @Validated
    public static class SystemProperties {
        /**
         * Scoring artifact location: {@code gs://bucket/path.json}, {@code classpath:...} or {@code file:...}.
         */
        @NotEmpty
        private String modelLocation;

        /**
         * Records with more Default-sourced features than this are unusable.
         */
        @PositiveOrZero
        private int maxDefaultFeatures = 3;

        /**
         * Features that must not be Default-sourced for this system.
         */
        private List<String> criticalFeatures = new ArrayList<>();

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double qualityFloor = 70.0;

        /**
         * Smallest |predicted - line| that yields a directional recommendation.
         */
        @PositiveOrZero
        private double minEdge = 1.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.5;
    }

    @Data
    @Validated
    public static class ExecutionLogProperties {
        private boolean enabled = true;
        @NotEmpty
        private String dataset = "propcast_orchestration";
        @NotEmpty
        private String table = "worker_execution_log";
    }

    /**
     * Items are stale once this much time has passed since the end of their date.
     */
    @NotNull
    private Duration staleThreshold = Duration.ofHours(12);

    @NotNull
    private ZoneId zone = ZoneId.of("America/New_York");

    /**
     * Topic the coordinator's {@code /complete} push subscription reads from.
     */
    @NotEmpty
    private String completionTopic = "prediction-ready";

    private String workerId = "local";

    /**
     * Feature names in FeatureVector order.
     */
    @NotEmpty
    private List<String> featureNames = new ArrayList<>();

    @Valid
    private Map<String, SystemProperties> systems = new HashMap<>();

    /**
     * Values upstream has been seen substituting for missing data. A Default-sourced feature holding one of these
     * is contamination.
     */
    private List<Double> sentinelValues = new ArrayList<>(List.of(112.0));

    /**
     * Weight of a Default-sourced feature in the quality score; Real features weigh 100.
     */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double defaultSourceWeight = 40.0;

    @Valid
    @NotNull
    private ExecutionLogProperties executionLog = new ExecutionLogProperties();

    public Optional<SystemProperties> system(String systemId) {
        return Optional.ofNullable(systemId).map(systems::get);
    }
}
