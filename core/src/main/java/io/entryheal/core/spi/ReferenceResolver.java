package io.entryheal.core.spi;

/**
 * Answers whether a referenced entry exists. May perform blocking I/O against the storage
 * substrate; the engine bounds every call with the configured reference timeout and may call it
 * from several threads at once.
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * @param entryType the entry type of the referenced entry
     * @param id the referenced entry id
     * @return {@code true} if the entry exists
     * @throws io.entryheal.core.error.ReferenceResolutionException if existence cannot be
     *     determined
     */
    boolean exists(String entryType, String id);

    /** Resolver that treats every reference as present. */
    static ReferenceResolver acceptAll() {
        return (entryType, id) -> true;
    }
}
