package io.entryheal.core.spi;

import java.util.Optional;

/**
 * Read path into a prior schema version, for entries not yet re-created under the current one.
 * The transport behind it (a remote call to the previous module) is the caller's concern; the
 * engine bounds every call with the configured bridge timeout.
 */
@FunctionalInterface
public interface LegacyBridge {

    /**
     * Fetches the legacy encoding of an entry.
     *
     * @param entryType the entry type
     * @param id the entry id
     * @return the legacy JSON bytes, or empty if the prior version has no such entry
     * @throws io.entryheal.core.error.LegacyBridgeUnavailableException if the prior version is
     *     unreachable (treated as "no legacy data")
     * @throws io.entryheal.core.error.LegacyBridgeException if the prior version answered with an
     *     error
     */
    Optional<byte[]> fetch(String entryType, String id);
}
