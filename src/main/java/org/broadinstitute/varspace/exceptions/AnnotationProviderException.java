package org.broadinstitute.varspace.exceptions;

/**
 * Failures raised by an {@code AnnotationProvider} while scoring variants.
 * <p>
 * {@link ProviderUnavailable} is a per-variant failure the apply engine recovers from by writing the NA
 * sentinel; {@link SystemicProviderFailure} (configuration, authentication, missing model) aborts the whole run.
 * </p>
 */
public abstract class AnnotationProviderException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    protected AnnotationProviderException(final String message) {
        super(message);
    }

    protected AnnotationProviderException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public static class ProviderUnavailable extends AnnotationProviderException {
        private static final long serialVersionUID = 0L;

        public ProviderUnavailable(final String providerName, final String message) {
            super(String.format("Provider %s could not score the variant: %s", providerName, message));
        }

        public ProviderUnavailable(final String providerName, final String message, final Throwable cause) {
            super(String.format("Provider %s could not score the variant: %s", providerName, message), cause);
        }
    }

    public static class SystemicProviderFailure extends AnnotationProviderException {
        private static final long serialVersionUID = 0L;

        public SystemicProviderFailure(final String providerName, final String message) {
            super(String.format("Provider %s failed: %s", providerName, message));
        }

        public SystemicProviderFailure(final String providerName, final String message, final Throwable cause) {
            super(String.format("Provider %s failed: %s", providerName, message), cause);
        }
    }
}
