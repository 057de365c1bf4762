package org.broadinstitute.varspace.annotation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The {@link AnnotationProvider} in use for each {@link AnnotationTool}.
 */
public final class AnnotationProviderRegistry {

    private static final Logger logger = LogManager.getLogger(AnnotationProviderRegistry.class);

    private final Map<AnnotationTool, AnnotationProvider> providers = Collections.synchronizedMap(new EnumMap<>(AnnotationTool.class));

    /**
     * Registers a provider, replacing (and closing) any previously registered for {@code tool}.
     */
    public AnnotationProviderRegistry register(final AnnotationTool tool, final AnnotationProvider provider) {
        Utils.nonNull(tool, "the tool cannot be null");
        Utils.nonNull(provider, "the provider cannot be null");
        final AnnotationProvider previous = providers.put(tool, provider);
        if (previous != null && previous != provider) {
            logger.info("Replacing provider " + previous.getName() + " for " + tool + " with " + provider.getName());
            previous.close();
        }
        return this;
    }

    /**
     * @throws UserException.ValidationError if no provider is registered for {@code tool}.
     */
    public AnnotationProvider get(final AnnotationTool tool) {
        Utils.nonNull(tool, "the tool cannot be null");
        final AnnotationProvider provider = providers.get(tool);
        if (provider == null) {
            throw new UserException.ValidationError("no annotation provider is registered for " + tool);
        }
        return provider;
    }

    public Set<AnnotationTool> getRegisteredTools() {
        synchronized (providers) {
            return Collections.unmodifiableSet(new TreeSet<>(providers.keySet()));
        }
    }
}
