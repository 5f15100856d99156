package com.telemetrylens.service;

import com.telemetrylens.core.error.SourceUnavailableException;
import com.telemetrylens.core.model.TimeRange;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.SeriesQuery;
import com.telemetrylens.core.source.SeriesTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileSeriesSource}.
 */
class FileSeriesSourceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private FileSeriesSource source;

    @BeforeEach
    void setUp() {
        source = new FileSeriesSource(dir, Runnable::run);
    }

    @Test
    @DisplayName("Should return points inside the range in timestamp order")
    void shouldFilterAndSort() throws IOException {
        Files.writeString(dir.resolve("cpu.json"), "["
                + "{\"timestamp\":\"2024-01-01T00:10:00Z\",\"value\":3.5},"
                + "{\"timestamp\":\"2024-01-01T00:05:00Z\",\"value\":null},"
                + "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":1.0,\"unit\":\"percent\"},"
                + "{\"timestamp\":\"2024-01-01T00:15:00Z\",\"value\":9.0}"
                + "]");

        List<TimeSeriesPoint> points = source.fetchBucketed(query(SeriesTarget.field("cpu"))).join();

        assertThat(points).extracting(TimeSeriesPoint::getTimestamp)
                .containsExactly(T0, T0.plusSeconds(300), T0.plusSeconds(600));
        assertThat(points.get(1).isMissing()).isTrue();
        assertThat(points.get(2).getValue()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Should resolve log targets to their labelled files")
    void shouldResolveLogTargets() throws IOException {
        Files.writeString(dir.resolve("pattern:timeout.json"),
                "[{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":4}]");

        List<TimeSeriesPoint> points = source.fetchBucketed(query(SeriesTarget.logPattern("timeout"))).join();

        assertThat(points).singleElement().satisfies(p -> assertThat(p.getValue()).isEqualTo(4.0));
    }

    @Test
    @DisplayName("Should fail with SourceUnavailableException when the file is missing")
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> source.fetchBucketed(query(SeriesTarget.field("disk"))).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("disk");
    }

    @Test
    @DisplayName("Should fail with SourceUnavailableException when the file is malformed")
    void shouldFailForMalformedFile() throws IOException {
        Files.writeString(dir.resolve("cpu.json"), "{\"not\": \"an array\"");

        assertThatThrownBy(() -> source.fetchBucketed(query(SeriesTarget.field("cpu"))).join())
                .hasCauseInstanceOf(SourceUnavailableException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SeriesQuery query(SeriesTarget target) {
        return SeriesQuery.builder()
                .target(target)
                .interval(Duration.ofMinutes(5))
                .range(TimeRange.of(T0, T0.plusSeconds(900)))
                .build();
    }
}
