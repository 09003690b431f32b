package com.dnd.navigator.health;

/**
 * Checks one dependency of the navigator. Implementations report failures as an OFFLINE or
 * DEGRADED {@link HealthStatus} and do not throw.
 */
public interface HealthCheck {

    /**
     * Component name, used as the key of this check's result in the aggregate status.
     */
    String component();

    HealthStatus check();
}
