package com.gateway.pool.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates registered health checks. The overall status is the worst individual status;
 * each check's result is attached as a detail under the check's name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, Object> results = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, results);
    }

    public int size() {
        return checks.size();
    }
}
