package io.entryheal.core.registry;

import io.entryheal.core.error.DuplicateEntryTypeException;
import io.entryheal.core.model.EntryTypeProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map from entry type to {@link EntryTypeProvider}, with an init-then-freeze lifecycle.
 *
 * <p>During process initialization a single thread calls {@link #register} once per entry type.
 * {@link #freeze()} (called by the orchestrator that takes ownership of the registry) publishes an
 * unmodifiable snapshot through a volatile field; from then on lookups are lock-free and safe
 * from any thread, and further registration is rejected. This is not a general-purpose
 * concurrent map: registering from several threads is not supported.
 */
public final class ProviderRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, EntryTypeProvider> pending = new LinkedHashMap<>();
    private volatile Map<String, EntryTypeProvider> frozen;

    /**
     * Registers a provider under its entry type.
     *
     * @param provider the provider to register
     * @return this registry (fluent)
     * @throws NullPointerException if provider is null
     * @throws DuplicateEntryTypeException if the entry type already has a provider
     * @throws IllegalStateException if the registry is frozen
     */
    public ProviderRegistry register(EntryTypeProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        if (frozen != null) {
            throw new IllegalStateException(
                    "Registry is frozen; cannot register entry type '" + provider.entryType() + "'");
        }
        if (pending.containsKey(provider.entryType())) {
            throw new DuplicateEntryTypeException(provider.entryType());
        }
        pending.put(provider.entryType(), provider);
        LOG.debug("Registered provider: entry_type={}", provider.entryType());
        return this;
    }

    /**
     * Ends the registration phase. Idempotent.
     *
     * @return this registry
     */
    public ProviderRegistry freeze() {
        if (frozen == null) {
            frozen = Collections.unmodifiableMap(new LinkedHashMap<>(pending));
            LOG.info("Provider registry frozen: entry_types={}", frozen.keySet());
        }
        return this;
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    /**
     * Looks up the provider for an entry type.
     *
     * @param entryType the entry type
     * @return the provider, or empty if none is registered
     */
    public Optional<EntryTypeProvider> get(String entryType) {
        if (entryType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(view().get(entryType));
    }

    /** Returns {@code true} if a provider is registered for the entry type. */
    public boolean contains(String entryType) {
        return entryType != null && view().containsKey(entryType);
    }

    /** Registered entry types, in registration order. */
    public Set<String> entryTypes() {
        return Collections.unmodifiableSet(view().keySet());
    }

    /** Returns the number of registered providers. */
    public int size() {
        return view().size();
    }

    private Map<String, EntryTypeProvider> view() {
        Map<String, EntryTypeProvider> snapshot = frozen;
        return snapshot != null ? snapshot : pending;
    }
}
