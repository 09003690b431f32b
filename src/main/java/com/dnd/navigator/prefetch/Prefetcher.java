package com.dnd.navigator.prefetch;

import com.dnd.navigator.core.model.CategoryItemSummary;
import com.dnd.navigator.fetch.FetchResult;
import com.dnd.navigator.fetch.ItemFetcher;
import com.dnd.navigator.logging.LogContext;
import com.dnd.navigator.metrics.MetricsService;
import com.dnd.navigator.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background cache warm-up.
 *
 * <p>Each category runs in its own lane: the listing is fetched through the cache, then every
 * item not already cached is fetched with at most
 * {@link PrefetchConfig#maxInFlightPerCategory()} requests in flight. Already-cached items are
 * skipped, so warming the same category twice issues no redundant upstream calls.</p>
 *
 * <p>{@link #warm(List)} returns immediately. Failures of an item or a whole category are logged
 * and reported, never thrown. Concurrent warm-ups of one category share a single run.</p>
 */
public class Prefetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Prefetcher.class);

    private final ItemFetcher fetcher;
    private final PrefetchConfig config;
    private final MetricsService metricsService;
    private final ExecutorService laneExecutor;
    private final ExecutorService itemExecutor;
    private final ConcurrentMap<String, CompletableFuture<PrefetchReport>> inFlight = new ConcurrentHashMap<>();

    public Prefetcher(ItemFetcher fetcher, PrefetchConfig config) {
        this(fetcher, config, new NoOpMetricsService());
    }

    public Prefetcher(ItemFetcher fetcher, PrefetchConfig config, MetricsService metricsService) {
        this.fetcher = fetcher;
        this.config = config;
        this.metricsService = metricsService;
        this.laneExecutor = Executors.newFixedThreadPool(config.lanes(), daemonThreads("prefetch-lane-"));
        this.itemExecutor = Executors.newFixedThreadPool(
                config.lanes() * config.maxInFlightPerCategory(), daemonThreads("prefetch-item-"));
    }

    /**
     * Starts warming the given categories in the background.
     *
     * @return a future completing with one report per distinct category, in input order
     */
    public CompletableFuture<List<PrefetchReport>> warm(List<String> categories) {
        List<CompletableFuture<PrefetchReport>> futures = new LinkedHashSet<>(categories).stream()
                .map(this::warmCategory)
                .toList();
        log.info("Prefetch started for {}", categories);
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    /**
     * Starts warming one category, or joins the run already in progress for it.
     */
    public CompletableFuture<PrefetchReport> warmCategory(String category) {
        CompletableFuture<PrefetchReport> created = new CompletableFuture<>();
        CompletableFuture<PrefetchReport> existing = inFlight.putIfAbsent(category, created);
        if (existing != null) {
            log.debug("Prefetch of {} already running", category);
            return existing;
        }
        try {
            laneExecutor.execute(() -> {
                PrefetchReport report;
                try {
                    report = runCategory(category);
                } catch (RuntimeException e) {
                    log.error("Prefetch of {} failed unexpectedly", category, e);
                    report = PrefetchReport.failed(category, e.getMessage());
                }
                inFlight.remove(category, created);
                created.complete(report);
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(category, created);
            created.complete(PrefetchReport.failed(category, "Prefetcher is shut down"));
        }
        return created;
    }

    /**
     * Stops accepting work and waits up to {@code timeout} for running warm-ups to finish.
     * Work still running after the timeout is interrupted; the cache stays partially warm.
     *
     * @return true if everything finished in time
     */
    public boolean shutdown(Duration timeout) {
        laneExecutor.shutdown();
        try {
            long deadline = System.nanoTime() + timeout.toNanos();
            boolean lanesDone = laneExecutor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
            itemExecutor.shutdown();
            long remaining = Math.max(0, deadline - System.nanoTime());
            boolean itemsDone = itemExecutor.awaitTermination(remaining, TimeUnit.NANOSECONDS);
            if (!lanesDone || !itemsDone) {
                laneExecutor.shutdownNow();
                itemExecutor.shutdownNow();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            laneExecutor.shutdownNow();
            itemExecutor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    private PrefetchReport runCategory(String category) {
        try (LogContext ctx = LogContext.forPrefetch(category)) {
            FetchResult<List<CategoryItemSummary>> listing = fetcher.fetchCategoryList(category);
            if (!listing.isSuccess()) {
                log.warn("Skipping prefetch of {}: {}", category, listing.error().message());
                metricsService.incrementPrefetchFailures(category);
                return PrefetchReport.failed(category, listing.error().message());
            }

            List<CategoryItemSummary> items = listing.value();
            Semaphore permits = new Semaphore(config.maxInFlightPerCategory());
            List<CompletableFuture<Boolean>> pending = new ArrayList<>();
            int skipped = 0;

            for (CategoryItemSummary item : items) {
                if (fetcher.isItemCached(category, item.index())) {
                    skipped++;
                    continue;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Prefetch of {} interrupted", category);
                    break;
                }
                try {
                    pending.add(CompletableFuture.supplyAsync(() -> {
                        try {
                            return fetchOne(category, item);
                        } finally {
                            permits.release();
                        }
                    }, itemExecutor));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    log.info("Prefetch of {} stopped: executor shut down", category);
                    break;
                }
            }

            int fetched = 0;
            int failed = 0;
            for (CompletableFuture<Boolean> future : pending) {
                if (future.join()) {
                    fetched++;
                } else {
                    failed++;
                }
            }

            log.info("Prefetch of {} finished: listed={}, fetched={}, skipped={}, failed={}",
                    category, items.size(), fetched, skipped, failed);
            return new PrefetchReport(category, items.size(), fetched, skipped, failed, null);
        }
    }

    private boolean fetchOne(String category, CategoryItemSummary item) {
        FetchResult<JsonNode> result;
        try {
            result = fetcher.fetchItem(category, item.index());
        } catch (RuntimeException e) {
            log.error("Unexpected error prefetching {}/{}", category, item.index(), e);
            metricsService.incrementPrefetchFailures(category);
            return false;
        }
        if (result.isSuccess()) {
            metricsService.incrementPrefetchedItems(category);
            return true;
        }
        log.warn("Failed to prefetch {}/{}: {}", category, item.index(), result.error().message());
        metricsService.incrementPrefetchFailures(category);
        return false;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
