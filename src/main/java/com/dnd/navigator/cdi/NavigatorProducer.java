package com.dnd.navigator.cdi;

import com.dnd.navigator.api.DndNavigator;
import com.dnd.navigator.api.NavigatorOptions;
import com.dnd.navigator.metrics.MetricsService;
import com.dnd.navigator.metrics.NoOpMetricsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * CDI producer that wires the navigator from MicroProfile Config properties.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties}; any of them can be
 * overridden by the hosting application:</p>
 * <pre>
 * dnd-navigator.api.base-url=https://www.dnd5eapi.co/api/
 * dnd-navigator.cache.ttl-hours=24
 * dnd-navigator.cache.persistent=true
 * dnd-navigator.prefetch.categories=spells,equipment,monsters,classes,races
 * </pre>
 *
 * <p>If the application produces a {@link MetricsService} bean it is used; otherwise metrics
 * are disabled.</p>
 */
@ApplicationScoped
public class NavigatorProducer {

    private static final Logger log = LoggerFactory.getLogger(NavigatorProducer.class);

    // ── Upstream API ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "dnd-navigator.api.base-url", defaultValue = "https://www.dnd5eapi.co/api/")
    String baseUrl;

    @Inject
    @ConfigProperty(name = "dnd-navigator.api.timeout-seconds", defaultValue = "10")
    int timeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "dnd-navigator.cache.ttl-hours", defaultValue = "24")
    long ttlHours;

    @Inject
    @ConfigProperty(name = "dnd-navigator.cache.persistent", defaultValue = "true")
    boolean persistent;

    @Inject
    @ConfigProperty(name = "dnd-navigator.cache.dir", defaultValue = "cache")
    String cacheDir;

    @Inject
    @ConfigProperty(name = "dnd-navigator.cache.max-memory-entries", defaultValue = "0")
    long maxMemoryEntries;

    // ── Prefetch ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "dnd-navigator.prefetch.enabled", defaultValue = "true")
    boolean prefetchEnabled;

    @Inject
    @ConfigProperty(name = "dnd-navigator.prefetch.categories",
            defaultValue = "spells,equipment,monsters,classes,races")
    List<String> prefetchCategories;

    @Inject
    @ConfigProperty(name = "dnd-navigator.prefetch.lanes", defaultValue = "5")
    int prefetchLanes;

    @Inject
    @ConfigProperty(name = "dnd-navigator.prefetch.max-in-flight", defaultValue = "4")
    int maxInFlight;

    @Inject
    Instance<MetricsService> metricsServices;

    @Produces
    @ApplicationScoped
    public DndNavigator dndNavigator() {
        log.info("Producing DndNavigator: baseUrl={} persistent={} cacheDir={}", baseUrl, persistent, cacheDir);
        return DndNavigator.builder()
                .options(buildOptions())
                .metricsService(resolveMetrics())
                .build();
    }

    public void closeNavigator(@Disposes DndNavigator navigator) {
        log.info("Closing DndNavigator");
        navigator.close();
    }

    NavigatorOptions buildOptions() {
        return NavigatorOptions.builder()
                .baseUrl(baseUrl)
                .requestTimeout(Duration.ofSeconds(timeoutSeconds))
                .ttlHours(ttlHours)
                .persistent(persistent)
                .cacheDir(Path.of(cacheDir))
                .maxMemoryEntries(maxMemoryEntries)
                .prefetchOnStartup(prefetchEnabled)
                .prefetchCategories(prefetchCategories)
                .prefetchLanes(prefetchLanes)
                .maxInFlightPerCategory(maxInFlight)
                .build();
    }

    private MetricsService resolveMetrics() {
        if (metricsServices != null && metricsServices.isResolvable()) {
            return metricsServices.get();
        }
        return new NoOpMetricsService();
    }
}
