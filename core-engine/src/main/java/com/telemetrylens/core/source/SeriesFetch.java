package com.telemetrylens.core.source;

import com.telemetrylens.core.error.SourceUnavailableException;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Calls a {@link SeriesSource} so that every way a fetch can fail ends up as
 * a {@link SourceUnavailableException}: a synchronous throw, an exceptional
 * future, or a {@code null} series.
 *
 * @since 1.0.0
 */
public final class SeriesFetch {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesFetch.class);

    private SeriesFetch() {
        // utility class, not instantiable
    }

    /**
     * @return a future that completes with the series or exceptionally with
     *         a {@link SourceUnavailableException}
     */
    public static CompletableFuture<List<TimeSeriesPoint>> fetch(SeriesSource source, SeriesQuery query) {
        Objects.requireNonNull(source, "Series source must not be null");
        Objects.requireNonNull(query, "Series query must not be null");
        CompletableFuture<List<TimeSeriesPoint>> future;
        try {
            future = source.fetchBucketed(query);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.completedFuture(null);
        }
        return future.handle((points, error) -> {
            if (error != null) {
                SourceUnavailableException failure = unavailable(error, query);
                LOG.error("Fetch failed for {}: {}", query.getTarget(), failure.getMessage());
                throw failure;
            }
            if (points == null) {
                throw new SourceUnavailableException("Source returned no series for " + query.getTarget().label());
            }
            return points;
        });
    }

    /**
     * Join a future, rethrowing a {@link SourceUnavailableException} cause
     * unwrapped.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof SourceUnavailableException sue) {
                throw sue;
            }
            throw e;
        }
    }

    /**
     * @return the cause of a {@link CompletionException}, or {@code error}
     *         itself
     */
    public static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
    }

    static SourceUnavailableException unavailable(Throwable error, SeriesQuery query) {
        Throwable cause = unwrap(error);
        return cause instanceof SourceUnavailableException sue
                ? sue
                : new SourceUnavailableException("Failed to fetch " + query.getTarget().label(), cause);
    }
}
