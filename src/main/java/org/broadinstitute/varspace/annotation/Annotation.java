package org.broadinstitute.varspace.annotation;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scores a provider produced for one variant, by output column, or NA when it has none.
 */
public final class Annotation {

    private static final Annotation NA = new Annotation(Collections.emptyMap());

    private final Map<String, String> scores;

    private Annotation(final Map<String, String> scores) {
        this.scores = scores;
    }

    public static Annotation na() {
        return NA;
    }

    public static Annotation of(final Map<String, String> scores) {
        Utils.nonNull(scores, "the scores cannot be null");
        return scores.isEmpty() ? NA : new Annotation(Collections.unmodifiableMap(new LinkedHashMap<>(scores)));
    }

    public static Annotation of(final String column, final double score) {
        return of(Collections.singletonMap(column, Double.toString(score)));
    }

    public boolean isNA() {
        return scores.isEmpty();
    }

    /**
     * The score for an output column; empty if the provider had none for it.
     */
    public Optional<String> getScore(final String column) {
        return Optional.ofNullable(scores.get(column));
    }

    public Map<String, String> getScores() {
        return scores;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Annotation && scores.equals(((Annotation) o).scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return isNA() ? "NA" : scores.toString();
    }
}
