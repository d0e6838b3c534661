package dev.devanks.propcast.shared.breaker;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "propcast.circuit-breaker")
public class CircuitBreakerProperties {

    /**
     * Consecutive transient failures that trip an entity's breaker.
     */
    @Positive
    private int failureThreshold = 5;

    /**
     * Cooldown applied when the breaker first trips. Doubles for every further failure.
     */
    @NotNull
    private Duration baseCooldown = Duration.ofMinutes(30);

    /**
     * Upper bound for the exponential cooldown.
     */
    @NotNull
    private Duration maxCooldown = Duration.ofHours(24);
}
