package io.entryheal.core.error;

/**
 * Thrown when a YAML provider definition cannot be parsed or compiled. Carries the source file or
 * resource so startup errors point at the offending definition.
 */
public final class ProviderSpecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ProviderSpecException(String message, String source) {
        super(message);
        this.source = source;
    }

    public ProviderSpecException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
