package io.entryheal.core.engine;

import io.entryheal.core.spi.ReferenceResolver;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers references that were found to exist. Entries are append-only, so a positive answer
 * stays true; negative answers and errors are not cached and are asked again next time.
 *
 * <p>Thread-safe: the cache is a concurrent set, and concurrent misses for the same key may each
 * reach the delegate.
 */
public final class CachingReferenceResolver implements ReferenceResolver {

    private final ReferenceResolver delegate;
    private final Set<String> known = ConcurrentHashMap.newKeySet();

    public CachingReferenceResolver(ReferenceResolver delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public boolean exists(String entryType, String id) {
        String key = entryType + '\u0000' + id;
        if (known.contains(key)) {
            return true;
        }
        boolean exists = delegate.exists(entryType, id);
        if (exists) {
            known.add(key);
        }
        return exists;
    }

    /** Number of cached positive answers. */
    public int cachedCount() {
        return known.size();
    }

    /** Drops all cached answers. */
    public void clear() {
        known.clear();
    }
}
