package com.libragraph.emlstore.core.service;

import java.time.Instant;

/**
 * CDI event for one {@link ManagedService} state change. Observed by
 * {@link ServiceDependencyCascade} to fail dependents.
 *
 * @param serviceId {@link ManagedService#serviceId()}, e.g. {@code "history"}
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Instant timestamp
) {}
