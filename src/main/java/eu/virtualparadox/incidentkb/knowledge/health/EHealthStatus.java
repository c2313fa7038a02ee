package eu.virtualparadox.incidentkb.knowledge.health;

public enum EHealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
