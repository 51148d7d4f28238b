package io.entryheal.core.error;

/**
 * The prior schema version could not be reached (timeout, role not installed, peer offline).
 * Treated exactly like "no legacy data found": strategies fall through to their next step.
 */
public final class LegacyBridgeUnavailableException extends HealingException {

    private static final long serialVersionUID = 1L;

    public LegacyBridgeUnavailableException(String message, String entryType, String entryId) {
        super(Kind.LEGACY_BRIDGE_UNAVAILABLE, message, entryType, entryId);
    }

    public LegacyBridgeUnavailableException(String message, Throwable cause, String entryType, String entryId) {
        super(Kind.LEGACY_BRIDGE_UNAVAILABLE, message, cause, entryType, entryId);
    }

    @Override
    public boolean isSoft() {
        return true;
    }
}
