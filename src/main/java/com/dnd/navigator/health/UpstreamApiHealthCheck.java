package com.dnd.navigator.health;

import com.dnd.navigator.upstream.ApiResponse;
import com.dnd.navigator.upstream.ReferenceApiClient;
import com.dnd.navigator.upstream.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Checks the upstream API root and reports latency and the number of available endpoints.
 * Always hits the network; never served from the cache.
 */
public class UpstreamApiHealthCheck implements HealthCheck {

    static final String COMPONENT = "upstream-api";

    private final ReferenceApiClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public UpstreamApiHealthCheck(ReferenceApiClient client) {
        this.client = client;
    }

    @Override
    public String component() {
        return COMPONENT;
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try {
            ApiResponse response = client.get("");
            long latencyMs = System.currentTimeMillis() - startMs;
            if (!response.isSuccess()) {
                return HealthStatus.offline(COMPONENT, "API returned non-200 status code: " + response.statusCode())
                        .withDetail("responseCode", response.statusCode())
                        .withDetail("latencyMs", latencyMs)
                        .withDetail("baseUrl", client.getBaseUrl());
            }
            JsonNode root = objectMapper.readTree(response.body());
            return HealthStatus.online(COMPONENT, "online")
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("endpointCount", root.size())
                    .withDetail("baseUrl", client.getBaseUrl());
        } catch (UpstreamException e) {
            return HealthStatus.offline(COMPONENT, "Failed to connect to API: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("baseUrl", client.getBaseUrl());
        } catch (JsonProcessingException e) {
            return HealthStatus.degraded(COMPONENT, "API root returned malformed JSON")
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
