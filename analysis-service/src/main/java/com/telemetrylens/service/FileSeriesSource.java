package com.telemetrylens.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.telemetrylens.core.error.SourceUnavailableException;
import com.telemetrylens.core.model.TimeRange;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.SeriesQuery;
import com.telemetrylens.core.source.SeriesSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link SeriesSource} that replays exported, already bucketed series from
 * a directory.
 *
 * <p>
 * A query for target label {@code L} reads {@code <dir>/L.json}, a JSON
 * array of {@code {"timestamp": "...", "value": ...}} objects in which
 * {@code value} may be {@code null} for a missing bucket. Points outside the
 * query range are dropped and the rest are returned in timestamp order. The
 * file is expected to hold the series at the requested interval and
 * aggregation; neither is recomputed here.
 * </p>
 *
 * <p>
 * A missing or malformed file fails the returned future with a
 * {@link SourceUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class FileSeriesSource implements SeriesSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileSeriesSource.class);
    private static final TypeReference<List<TimeSeriesPoint>> POINTS = new TypeReference<>() {
    };

    private final Path directory;
    private final Executor executor;
    private final ObjectMapper mapper;

    public FileSeriesSource(Path directory) {
        this(directory, ForkJoinPool.commonPool());
    }

    public FileSeriesSource(Path directory, Executor executor) {
        this.directory = Objects.requireNonNull(directory, "Series directory must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public CompletableFuture<List<TimeSeriesPoint>> fetchBucketed(SeriesQuery query) {
        Objects.requireNonNull(query, "Series query must not be null");
        return CompletableFuture.supplyAsync(() -> read(query), executor);
    }

    /**
     * @return the file that holds the series for {@code query}
     */
    Path fileFor(SeriesQuery query) {
        return directory.resolve(query.getTarget().label() + ".json");
    }

    private List<TimeSeriesPoint> read(SeriesQuery query) {
        Path file = fileFor(query);
        List<TimeSeriesPoint> points;
        try {
            points = mapper.readValue(Files.readAllBytes(file), POINTS);
        } catch (NoSuchFileException e) {
            throw new SourceUnavailableException("No series file for '" + query.getTarget().label()
                    + "': " + file, e);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read series file " + file + ": " + e.getMessage(), e);
        }
        if (points == null) {
            throw new SourceUnavailableException("Series file " + file + " holds no JSON array");
        }

        TimeRange range = query.getRange();
        List<TimeSeriesPoint> inRange = points.stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getTimestamp() != null && range.contains(p.getTimestamp()))
                .sorted(Comparator.comparing(TimeSeriesPoint::getTimestamp))
                .toList();
        LOG.debug("Read {} of {} point(s) from {} within {}", inRange.size(), points.size(), file, range);
        return inRange;
    }
}
