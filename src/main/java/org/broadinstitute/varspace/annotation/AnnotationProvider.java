package org.broadinstitute.varspace.annotation;

import org.broadinstitute.varspace.exceptions.AnnotationProviderException;
import org.broadinstitute.varspace.variant.VariantKey;

import java.io.Closeable;
import java.util.List;

/**
 * Source of scores for one {@link AnnotationTool}, such as a model, a remote service or a local score table.
 */
public interface AnnotationProvider extends Closeable {

    /**
     * Name used in log messages and errors.
     */
    String getName();

    /**
     * Names of the score columns this provider produces, before the tool suffix is applied.
     */
    List<String> getOutputColumns();

    /**
     * Scores one variant.
     *
     * @param key        the variant, in hg38 coordinates.
     * @param transcript transcript identifier for transcript-keyed tools; may be {@code null}.
     * @return the scores, or {@link Annotation#na()} if the provider has none for this variant.
     * @throws AnnotationProviderException.ProviderUnavailable     if this variant could not be scored right now.
     * @throws AnnotationProviderException.SystemicProviderFailure if the provider cannot score anything.
     */
    Annotation annotate(VariantKey key, String transcript);

    @Override
    default void close() {}
}
