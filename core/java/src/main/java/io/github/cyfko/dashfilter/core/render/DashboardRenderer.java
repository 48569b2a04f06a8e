package io.github.cyfko.dashfilter.core.render;

import io.github.cyfko.dashfilter.core.compose.FilterComposer;
import io.github.cyfko.dashfilter.core.config.ExecutionPolicy;
import io.github.cyfko.dashfilter.core.exception.ChartExecutionException;
import io.github.cyfko.dashfilter.core.exception.MissingRequiredFilterException;
import io.github.cyfko.dashfilter.core.model.ChartComposition;
import io.github.cyfko.dashfilter.core.model.ChartResult;
import io.github.cyfko.dashfilter.core.model.FilterValues;
import io.github.cyfko.dashfilter.core.model.QueryResult;
import io.github.cyfko.dashfilter.core.spi.ChartQueryExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders a filtered dashboard: composes every chart, then executes the composed queries concurrently.
 *
 * <h2>Failure isolation</h2>
 * <ul>
 *   <li>A chart whose composition failed is reported with the composition error and never executed.</li>
 *   <li>An exception thrown by the {@link ChartQueryExecutor} marks that chart only.</li>
 *   <li>A chart the pool refuses to accept (saturated or shut down) is marked failed.</li>
 *   <li>A chart still running after {@link ExecutionPolicy#chartTimeout()} is cancelled and marked failed.
 *       The timeout runs from the moment the chart starts executing, not from submission.</li>
 * </ul>
 * <p>
 * Only {@link MissingRequiredFilterException} fails the whole render: a dashboard with a required
 * filter left empty does not show partial data. Nothing is retried.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (DashboardRenderer renderer = new DashboardRenderer(composer, executor, ExecutionPolicy.defaults())) {
 *     Map<Long, ChartResult> charts = renderer.render(42L, filterValues);
 *     charts.values().stream().filter(c -> !c.isSuccess()).forEach(c -> log(c.error()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DashboardRenderer implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(DashboardRenderer.class.getName());

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final FilterComposer composer;
    private final ChartQueryExecutor executor;
    private final ExecutionPolicy policy;
    private final ExecutorService pool;
    private final boolean ownsPool;

    /**
     * Creates a renderer with its own pool of {@link ExecutionPolicy#parallelism()} daemon threads,
     * released by {@link #close()}.
     */
    public DashboardRenderer(FilterComposer composer, ChartQueryExecutor executor, ExecutionPolicy policy) {
        this(composer, executor, policy, Executors.newFixedThreadPool(policy.parallelism(), daemonThreads()), true);
    }

    /**
     * Creates a renderer running charts on a caller-managed pool, left open by {@link #close()}.
     */
    public DashboardRenderer(FilterComposer composer, ChartQueryExecutor executor, ExecutionPolicy policy,
                             ExecutorService pool) {
        this(composer, executor, policy, pool, false);
    }

    private DashboardRenderer(FilterComposer composer, ChartQueryExecutor executor, ExecutionPolicy policy,
                              ExecutorService pool, boolean ownsPool) {
        this.composer = Objects.requireNonNull(composer, "composer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.ownsPool = ownsPool;
    }

    /**
     * Composes and executes every chart of a dashboard.
     *
     * @param dashboardId  dashboard identifier
     * @param filterValues viewer filter values keyed by selector name
     * @return one result per chart, in composition order
     * @throws MissingRequiredFilterException if a required selector has no active value
     */
    public Map<Long, ChartResult> render(long dashboardId, FilterValues filterValues) {
        long start = System.nanoTime();
        Map<Long, ChartComposition> compositions = composer.compose(dashboardId, filterValues);

        Map<Long, RunningChart> running = new LinkedHashMap<>();
        Map<Long, ChartResult> rejected = new LinkedHashMap<>();
        for (ChartComposition composition : compositions.values()) {
            if (!composition.isSuccess()) {
                continue;
            }
            long chartId = composition.chartId();
            try {
                running.put(chartId, submit(composition));
            } catch (RejectedExecutionException e) {
                logger.log(Level.WARNING, "Chart " + chartId + " was rejected by the execution pool", e);
                rejected.put(chartId, ChartResult.failure(chartId, composition.result(),
                        "Query was rejected by the execution pool"));
            }
        }

        Map<Long, ChartResult> results = new LinkedHashMap<>();
        for (ChartComposition composition : compositions.values()) {
            long chartId = composition.chartId();
            if (!composition.isSuccess()) {
                results.put(chartId, ChartResult.failure(chartId, null, composition.error().getMessage()));
                continue;
            }
            if (rejected.containsKey(chartId)) {
                results.put(chartId, rejected.get(chartId));
                continue;
            }
            results.put(chartId, await(composition, running.get(chartId), running.size()));
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        long failed = results.values().stream().filter(r -> !r.isSuccess()).count();
        logger.info(() -> String.format("Rendered dashboard %d in %dms: %d chart(s), %d failed",
                dashboardId, durationMs, results.size(), failed));
        return results;
    }

    private RunningChart submit(ChartComposition composition) {
        AtomicLong startedAt = new AtomicLong();
        Future<QueryResult> future = pool.submit(() -> {
            startedAt.set(System.nanoTime());
            return executor.execute(composition.chartId(), composition.result().filteredSql());
        });
        return new RunningChart(future, System.nanoTime(), startedAt);
    }

    /**
     * Waits for one chart. A chart that never gets a worker thread gives up once every chart ahead
     * of it could have used its full timeout.
     */
    private ChartResult await(ChartComposition composition, RunningChart chart, int chartCount) {
        long chartId = composition.chartId();
        long timeoutNanos = policy.chartTimeout().toNanos();
        long queueNanos = timeoutNanos * chartCount;
        try {
            while (true) {
                long started = chart.startedAt().get();
                long remaining = started == 0 ? timeoutNanos : started + timeoutNanos - System.nanoTime();
                try {
                    QueryResult data = chart.future().get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
                    return ChartResult.success(chartId, composition.result(), data);
                } catch (TimeoutException e) {
                    long startedNow = chart.startedAt().get();
                    long now = System.nanoTime();
                    if (startedNow == 0 && now - chart.submittedAt() >= queueNanos) {
                        chart.future().cancel(true);
                        logger.warning(() -> "Chart " + chartId + " never started executing");
                        return ChartResult.failure(chartId, composition.result(), "Query was never started");
                    }
                    if (startedNow != 0 && now - startedNow >= timeoutNanos) {
                        chart.future().cancel(true);
                        logger.warning(() -> "Chart " + chartId + " timed out after "
                                + policy.chartTimeout().toMillis() + "ms");
                        return ChartResult.failure(chartId, composition.result(),
                                "Query timed out after " + policy.chartTimeout().toMillis() + "ms");
                    }
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ChartExecutionException failure = cause instanceof ChartExecutionException chartFailure
                    ? chartFailure
                    : new ChartExecutionException(chartId, cause.getMessage(), cause);
            logger.log(Level.WARNING, "Chart " + chartId + " failed: " + failure.getMessage(), cause);
            return ChartResult.failure(chartId, composition.result(), failure.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            chart.future().cancel(true);
            return ChartResult.failure(chartId, composition.result(), "Rendering interrupted");
        }
    }

    /**
     * Shuts the pool down when this renderer created it.
     */
    @Override
    public void close() {
        if (!ownsPool) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(policy.chartTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dashfilter-render-" + poolId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record RunningChart(Future<QueryResult> future, long submittedAt, AtomicLong startedAt) {
    }
}
