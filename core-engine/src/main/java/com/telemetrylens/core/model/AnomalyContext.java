package com.telemetrylens.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Optional decoration attached to an anomaly by an
 * {@link com.telemetrylens.core.source.EnrichmentSource}. Never used for
 * scoring.
 *
 * @since 1.0.0
 */
public final class AnomalyContext {

    private final String dominantService;
    private final String dominantLevel;
    private final List<String> examples;

    public AnomalyContext(String dominantService, String dominantLevel, List<String> examples) {
        this.dominantService = dominantService;
        this.dominantLevel = dominantLevel;
        this.examples = examples != null ? List.copyOf(examples) : Collections.emptyList();
    }

    public String getDominantService() {
        return dominantService;
    }

    public String getDominantLevel() {
        return dominantLevel;
    }

    public List<String> getExamples() {
        return examples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyContext that))
            return false;
        return Objects.equals(dominantService, that.dominantService)
                && Objects.equals(dominantLevel, that.dominantLevel)
                && examples.equals(that.examples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dominantService, dominantLevel, examples);
    }

    @Override
    public String toString() {
        return "AnomalyContext{service=" + dominantService + ", level=" + dominantLevel
                + ", examples=" + examples.size() + '}';
    }
}
