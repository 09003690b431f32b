package com.dnd.navigator.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of checking one navigator component (the reference API, the cache directory) or the
 * navigator as a whole.
 *
 * @param component name the result is reported under, e.g. {@code upstream-api}
 * @param status    ONLINE, DEGRADED (still serving, from the cache) or OFFLINE
 * @param message   short human-readable summary
 * @param details   facts about the component such as latency, endpoint count or cache directory
 */
public record HealthStatus(String component, Status status, String message, Map<String, Object> details) {

    public enum Status {
        ONLINE, DEGRADED, OFFLINE;

        boolean isWorseThan(Status other) {
            return ordinal() > other.ordinal();
        }
    }

    public HealthStatus {
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(status, "status must not be null");
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus online(String component, String message) {
        return new HealthStatus(component, Status.ONLINE, message, Map.of());
    }

    public static HealthStatus degraded(String component, String reason) {
        return new HealthStatus(component, Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus offline(String component, String reason) {
        return new HealthStatus(component, Status.OFFLINE, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(details);
        newDetails.put(key, value);
        return new HealthStatus(component, status, message, newDetails);
    }

    public boolean isOnline() {
        return status == Status.ONLINE;
    }
}
