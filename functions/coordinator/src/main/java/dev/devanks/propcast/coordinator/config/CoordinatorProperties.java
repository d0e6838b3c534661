// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/config/CoordinatorProperties.java
package dev.devanks.propcast.coordinator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "coordinator")
public class CoordinatorProperties {

    @Data
    @Validated
    public static class DispatchProperties {
        /**
         * Topic the worker push subscription reads from.
         */
        @NotEmpty
        private String workItemTopic = "prediction-request";

        /**
         * Minimum delay between two consecutive work item publishes.
         */
        @NotNull
        private Duration publishInterval = Duration.ofMillis(5);

        /**
         * Publish attempts per work item, including the first.
         */
        @Positive
        private int publishMaxAttempts = 3;

        @NotNull
        private Duration publishInitialBackoff = Duration.ofSeconds(1);

        /**
         * Publishes between two writes of the enqueued entity ids. Each write also re-reads the batch and stops
         * the dispatch once the batch was reset.
         */
        @Positive
        private int progressFlushEvery = 25;
    }

    @Data
    @Validated
    public static class StallProperties {
        /**
         * A batch awaiting results with no progress for this long is stalled.
         */
        @NotNull
        private Duration age = Duration.ofMinutes(15);

        /**
         * Stalled batches at or above this share of results are consolidated with what they have.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minCompletionRatio = 0.9;

        /**
         * A PENDING or DISPATCHING batch untouched for this long lost its dispatcher and is marked FAILED.
         */
        @NotNull
        private Duration dispatchDeadline = Duration.ofMinutes(10);
    }

    @Data
    @Validated
    public static class DateWindowProperties {
        @PositiveOrZero
        private int daysBack = 1;
        @PositiveOrZero
        private int daysAhead = 2;
    }

    @Data
    @Validated
    public static class ApiProperties {
        @NotEmpty
        @URL
        private String entityUniverseUrl;

        @NotEmpty
        @URL
        private String referenceLineUrl;

        @NotEmpty
        private String apiKey; // Injected via sm://
    }

    /**
     * Scoring systems a batch is started for when {@code /start} names none.
     */
    @NotEmpty
    private List<String> systems = List.of("ensemble_v1");

    @NotNull
    private ZoneId zone = ZoneId.of("America/New_York");

    @Valid
    @NotNull
    private DispatchProperties dispatch = new DispatchProperties();

    @Valid
    @NotNull
    private StallProperties stall = new StallProperties();

    @Valid
    @NotNull
    private DateWindowProperties dateWindow = new DateWindowProperties();

    @Valid
    @NotNull
    private ApiProperties api = new ApiProperties();

    /**
     * Firestore collections checked by {@code /health/deep}.
     */
    private List<String> healthCheckCollections = List.of("stage_completions", "predictions", "prediction_batches");
}
