package fr.lapetina.hashlb.domain.model;

/**
 * Health status of an upstream host as reported by the membership layer.
 *
 * HEALTHY: Host passes health checks and takes its full share of traffic
 * DEGRADED: Host is reachable but should only receive traffic when no healthy host remains
 * UNHEALTHY: Host is failing health checks and is never eligible for hashing
 */
public enum HostHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
