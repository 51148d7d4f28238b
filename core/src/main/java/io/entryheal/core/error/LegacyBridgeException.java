package io.entryheal.core.error;

/** Hard legacy-bridge failure: the prior version answered, but with an error that must not be masked. */
public final class LegacyBridgeException extends HealingException {

    private static final long serialVersionUID = 1L;

    public LegacyBridgeException(String message) {
        super(Kind.LEGACY_BRIDGE_ERROR, message, null, null);
    }

    public LegacyBridgeException(String message, Throwable cause) {
        super(Kind.LEGACY_BRIDGE_ERROR, message, cause, null, null);
    }

    public LegacyBridgeException(String message, String entryType, String entryId) {
        super(Kind.LEGACY_BRIDGE_ERROR, message, entryType, entryId);
    }

    public LegacyBridgeException(String message, Throwable cause, String entryType, String entryId) {
        super(Kind.LEGACY_BRIDGE_ERROR, message, cause, entryType, entryId);
    }
}
