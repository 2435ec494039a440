package fr.lapetina.weather.aggregator.orchestration;

import fr.lapetina.weather.aggregator.domain.geocode.GeocodeCache;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeResolver;
import fr.lapetina.weather.aggregator.domain.model.Coordinate;
import fr.lapetina.weather.aggregator.domain.model.FetchMode;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import fr.lapetina.weather.aggregator.domain.source.WeatherSource;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;
import fr.lapetina.weather.aggregator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of weather sources for one city.
 *
 * The city is geocoded at most once before dispatch. Each source then runs on
 * the worker pool under its own deadline; a slow or failing source only
 * affects its own slot. Results come back in source order.
 */
public final class FetchOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    public static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(15);

    private final GeocodeResolver geocoder;
    private final WeatherHttpClient session;
    private final Duration sourceTimeout;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param geocoder        resolver used for the batch pre-resolution
     * @param session         HTTP session shared by every source
     * @param sourceTimeout   deadline of a single source call
     * @param maxParallelism  worker pool size
     * @param metricsRegistry metrics sink, or null to disable metrics
     */
    public FetchOrchestrator(
            GeocodeResolver geocoder,
            WeatherHttpClient session,
            Duration sourceTimeout,
            int maxParallelism,
            MetricsRegistry metricsRegistry
    ) {
        if (maxParallelism <= 0) {
            throw new IllegalArgumentException("maxParallelism must be positive: " + maxParallelism);
        }
        this.geocoder = Objects.requireNonNull(geocoder, "Geocoder is required");
        this.session = Objects.requireNonNull(session, "HTTP session is required");
        this.sourceTimeout = sourceTimeout != null ? sourceTimeout : DEFAULT_SOURCE_TIMEOUT;
        this.metricsRegistry = metricsRegistry;

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxParallelism, r -> {
            Thread t = new Thread(r, "weather-fetch-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public FetchOrchestrator(GeocodeResolver geocoder, WeatherHttpClient session) {
        this(geocoder, session, DEFAULT_SOURCE_TIMEOUT, 8, null);
    }

    /**
     * Fetches every source in parallel and waits for all of them.
     */
    public List<Observation> fetchConcurrently(String city, List<WeatherSource> sources) {
        return fetch(city, sources, FetchMode.CONCURRENT);
    }

    /**
     * Fetches the sources one after another, in order.
     */
    public List<Observation> fetchSequentially(String city, List<WeatherSource> sources) {
        return fetch(city, sources, FetchMode.SEQUENTIAL);
    }

    /**
     * Fetches every source in the given mode.
     *
     * @return one observation per source, in source order, each with a duration
     */
    public List<Observation> fetch(String city, List<WeatherSource> sources, FetchMode mode) {
        Objects.requireNonNull(city, "City is required");
        Objects.requireNonNull(mode, "Mode is required");
        if (closed.get()) {
            throw new IllegalStateException("Orchestrator is closed");
        }
        if (sources == null || sources.isEmpty()) {
            return List.of();
        }

        long startNanos = System.nanoTime();
        log.info("Fetching weather: city={}, sources={}, mode={}", city, sources.size(), mode);

        GeocodeCache cache = preResolve(city, sources);

        List<Observation> observations = mode == FetchMode.CONCURRENT
                ? dispatchAll(city, sources, cache)
                : dispatchOneByOne(city, sources, cache);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        if (metricsRegistry != null) {
            metricsRegistry.recordBatch(mode, elapsed);
        }
        log.info("Batch completed: city={}, mode={}, valid={}/{}, elapsedMs={}",
                city, mode, observations.stream().filter(Observation::isValid).count(),
                observations.size(), elapsed.toMillis());
        return observations;
    }

    private GeocodeCache preResolve(String city, List<WeatherSource> sources) {
        boolean needsCoordinates = sources.stream().anyMatch(WeatherSource::requiresCoordinates);
        if (!needsCoordinates) {
            return GeocodeCache.empty();
        }

        Outcome<Coordinate> resolved;
        try {
            resolved = geocoder.resolve(city, session);
        } catch (RuntimeException e) {
            log.warn("Geocoder threw unexpectedly: city={}", city, e);
            resolved = Outcome.failure(SourceError.geocoding(SourceError.network(e.getMessage())));
        }
        if (metricsRegistry != null) {
            metricsRegistry.recordGeocode(resolved.isSuccess());
        }

        if (resolved.isFailure()) {
            // Coordinate sources will retry on their own and report the error
            log.warn("Pre-resolution failed, continuing without coordinates: city={}, error={}",
                    city, resolved.error().message());
            return GeocodeCache.empty();
        }
        return GeocodeCache.of(city, resolved.value());
    }

    private List<Observation> dispatchAll(String city, List<WeatherSource> sources, GeocodeCache cache) {
        Duration queueBudget = sourceTimeout.multipliedBy(sources.size());
        List<SourceTask> tasks = new ArrayList<>(sources.size());
        for (WeatherSource source : sources) {
            tasks.add(submit(source, city, cache));
        }

        List<Observation> observations = new ArrayList<>(sources.size());
        for (SourceTask task : tasks) {
            observations.add(await(task, queueBudget));
        }
        return observations;
    }

    private List<Observation> dispatchOneByOne(String city, List<WeatherSource> sources, GeocodeCache cache) {
        Duration queueBudget = sourceTimeout.multipliedBy(sources.size());
        List<Observation> observations = new ArrayList<>(sources.size());
        for (WeatherSource source : sources) {
            observations.add(await(submit(source, city, cache), queueBudget));
        }
        return observations;
    }

    private SourceTask submit(WeatherSource source, String city, GeocodeCache cache) {
        SourceTask task = new SourceTask(source);
        task.future = executor.submit(() -> {
            task.markStarted();
            return invoke(source, city, cache);
        });
        return task;
    }

    /**
     * Waits for one source until its own deadline, measured from the moment a worker picks it up.
     * Time spent queued behind busy workers is bounded by {@code queueBudget} instead.
     */
    private Observation await(SourceTask task, Duration queueBudget) {
        WeatherSource source = task.source;
        Future<Observation> future = task.future;
        try {
            if (!task.started.await(queueBudget.toNanos(), TimeUnit.NANOSECONDS)) {
                future.cancel(true);
                log.warn("Source never started: source={}, queuedMs={}", source.name(), queueBudget.toMillis());
                return record(Observation.failure(source.name(), SourceError.timeout()), task.submittedNanos);
            }
            long remainingNanos = sourceTimeout.toNanos() - (System.nanoTime() - task.startedNanos);
            Observation observation = future.get(Math.max(remainingNanos, 0L), TimeUnit.NANOSECONDS);
            recordMetrics(observation);
            return observation;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Source timed out: source={}, timeoutMs={}", source.name(), sourceTimeout.toMillis());
            return record(Observation.failure(source.name(), SourceError.timeout()), task.startedNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return record(Observation.failure(source.name(), SourceError.network("interrupted")), task.submittedNanos);
        } catch (CancellationException e) {
            return record(Observation.failure(source.name(), SourceError.network("cancelled")), task.submittedNanos);
        } catch (ExecutionException e) {
            // invoke() catches everything; only Errors end up here
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Source task failed: source={}", source.name(), cause);
            return record(Observation.failure(source.name(),
                    SourceError.parsing(cause.getClass().getSimpleName())), task.submittedNanos);
        }
    }

    /**
     * Runs one source on a worker thread, timing it and shielding the batch from its exceptions.
     */
    private Observation invoke(WeatherSource source, String city, GeocodeCache cache) {
        long start = System.nanoTime();
        Observation observation;
        try {
            observation = source.fetch(city, session, cache);
            if (observation == null) {
                observation = Observation.failure(source.name(), SourceError.parsing("no observation returned"));
            }
        } catch (RuntimeException e) {
            log.error("Source threw unexpectedly: source={}, city={}", source.name(), city, e);
            observation = Observation.failure(source.name(), SourceError.parsing(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
        Observation timed = timed(observation, start);
        log.debug("Source finished: source={}, valid={}, latencyMs={}",
                source.name(), timed.isValid(), timed.durationMs());
        return timed;
    }

    private static Observation timed(Observation observation, long startNanos) {
        return observation.withDuration((System.nanoTime() - startNanos) / 1_000_000.0);
    }

    /**
     * Times an observation produced on the waiting thread and records it.
     */
    private Observation record(Observation observation, long startNanos) {
        Observation timed = timed(observation, startNanos);
        recordMetrics(timed);
        return timed;
    }

    // Only results handed back to the caller are counted; late finishers of cancelled tasks are not
    private void recordMetrics(Observation observation) {
        if (metricsRegistry != null) {
            metricsRegistry.recordSourceResult(observation,
                    Duration.ofNanos((long) (observation.durationMs() * 1_000_000)));
        }
    }

    public Duration getSourceTimeout() {
        return sourceTimeout;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Fetch orchestrator stopped");
        }
    }

    /**
     * One submitted source call and the moment a worker started it.
     */
    private static final class SourceTask {
        private final WeatherSource source;
        private final long submittedNanos = System.nanoTime();
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedNanos;
        private Future<Observation> future;

        SourceTask(WeatherSource source) {
            this.source = source;
        }

        void markStarted() {
            startedNanos = System.nanoTime();
            started.countDown();
        }
    }
}
