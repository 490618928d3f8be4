package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Result of a hypervisor connection health check.
 *
 * @param healthy whether the hypervisor answered
 * @param hostname host name reported by the hypervisor, null when unhealthy
 * @param activeDomains running domains
 * @param totalDomains all defined domains
 * @param uri connection URI
 * @param error failure description, null when healthy
 * @param timestamp when the check ran
 */
public record ConnectionHealth(
        boolean healthy,
        @Nullable String hostname,
        int activeDomains,
        int totalDomains,
        @Nonnull String uri,
        @Nullable String error,
        @Nonnull Instant timestamp) {
}
