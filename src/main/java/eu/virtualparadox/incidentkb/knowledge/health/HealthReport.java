package eu.virtualparadox.incidentkb.knowledge.health;

import java.time.Instant;

/**
 * Result of a health check.
 *
 * @param status               overall status
 * @param components           component flags, {@link HealthComponents#NONE} when the check itself failed
 * @param testSearchSuccessful whether the live test query returned at least one result
 * @param timestamp            time of the check
 * @param error                failure message when {@code status} is {@link EHealthStatus#UNHEALTHY}
 */
public record HealthReport(EHealthStatus status,
                           HealthComponents components,
                           boolean testSearchSuccessful,
                           Instant timestamp,
                           String error) {

    public static HealthReport unhealthy(final String error) {
        return new HealthReport(EHealthStatus.UNHEALTHY, HealthComponents.NONE, false, Instant.now(), error);
    }

    public boolean isHealthy() {
        return status == EHealthStatus.HEALTHY;
    }
}
