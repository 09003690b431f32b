package com.dnd.navigator.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs registered health checks and folds them into one {@code navigator} status: the worst
 * individual status wins (OFFLINE over DEGRADED over ONLINE), and each component's result is
 * attached as a detail under its name.
 */
public class HealthCheckRegistry {

    static final String COMPONENT = "navigator";

    private final List<HealthCheck> checks = new ArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.online(COMPONENT, "No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus worst = null;

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            results.put(result.component(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            if (worst == null || result.status().isWorseThan(worst.status())) {
                worst = result;
            }
        }

        String message = worst.isOnline() ? "online" : worst.component() + ": " + worst.message();
        return new HealthStatus(COMPONENT, worst.status(), message, results);
    }

    public int size() {
        return checks.size();
    }
}
