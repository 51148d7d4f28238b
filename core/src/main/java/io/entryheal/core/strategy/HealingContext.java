package io.entryheal.core.strategy;

import io.entryheal.core.error.HealingCancelledException;
import io.entryheal.core.error.HealingException;
import io.entryheal.core.error.LegacyBridgeException;
import io.entryheal.core.error.LegacyBridgeUnavailableException;
import io.entryheal.core.error.MaxAttemptsExceededException;
import io.entryheal.core.model.EntryTypeProvider;
import io.entryheal.core.spi.LegacyBridge;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-call state for one healing call: the matched provider, the caller's current-schema bytes,
 * the optional legacy bridge, and the attempt budget.
 *
 * <p>Owned by the single call that created it and discarded when the call returns. Not
 * thread-safe, and does not need to be.
 */
public final class HealingContext {

    private static final Logger LOG = LoggerFactory.getLogger(HealingContext.class);

    private final String entryId;
    private final EntryTypeProvider provider;
    private final byte[] currentBytes;
    private final LegacyBridge legacyBridge;
    private final int maxAttempts;
    private final Duration bridgeTimeout;
    private final Executor ioExecutor;

    private int attempts;
    private boolean bridgeCalled;

    private HealingContext(Builder b) {
        this.entryId = Objects.requireNonNull(b.entryId, "entryId must not be null");
        this.provider = Objects.requireNonNull(b.provider, "provider must not be null");
        this.currentBytes = b.currentBytes;
        this.legacyBridge = b.legacyBridge;
        this.maxAttempts = b.maxAttempts;
        this.bridgeTimeout = Objects.requireNonNull(b.bridgeTimeout, "bridgeTimeout must not be null");
        this.ioExecutor = b.ioExecutor;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        if (legacyBridge != null && ioExecutor == null) {
            throw new IllegalArgumentException("an ioExecutor is required when a legacy bridge is configured");
        }
    }

    /** Returns a builder for a call healing {@code entryId} with {@code provider}. */
    public static Builder builder(EntryTypeProvider provider, String entryId) {
        return new Builder(provider, entryId);
    }

    public String entryType() {
        return provider.entryType();
    }

    public String entryId() {
        return entryId;
    }

    public EntryTypeProvider provider() {
        return provider;
    }

    /** The caller's current-schema bytes, if it found any. */
    public Optional<byte[]> currentBytes() {
        return Optional.ofNullable(currentBytes);
    }

    public boolean hasLegacyBridge() {
        return legacyBridge != null;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Attempts consumed so far. */
    public int attempts() {
        return attempts;
    }

    /** Whether the legacy bridge has been called during this call. */
    public boolean bridgeCalled() {
        return bridgeCalled;
    }

    /**
     * Consumes one attempt from the budget.
     *
     * @throws MaxAttemptsExceededException if the budget is already spent
     */
    void consumeAttempt() {
        if (attempts >= maxAttempts) {
            throw new MaxAttemptsExceededException(maxAttempts, entryType(), entryId);
        }
        attempts++;
    }

    /**
     * Calls the legacy bridge, bounded by the bridge timeout. Timeouts and
     * {@link LegacyBridgeUnavailableException} both mean "no legacy data". Consumes one attempt;
     * callers check {@link #hasLegacyBridge()} first.
     *
     * @return the legacy bytes, or empty
     * @throws LegacyBridgeException if the bridge failed hard
     * @throws HealingCancelledException if the calling thread was interrupted
     */
    Optional<byte[]> fetchLegacy() {
        if (legacyBridge == null) {
            return Optional.empty();
        }
        consumeAttempt();
        bridgeCalled = true;
        String entryType = entryType();
        try {
            Optional<byte[]> legacy =
                    BoundedCall.run(ioExecutor, () -> legacyBridge.fetch(entryType, entryId), bridgeTimeout);
            return legacy == null ? Optional.empty() : legacy;
        } catch (TimeoutException e) {
            LOG.debug("Legacy bridge timed out after {} ms: entry_type={}, entry_id={}",
                    bridgeTimeout.toMillis(), entryType, entryId);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HealingCancelledException("Healing cancelled while waiting on the legacy bridge", e,
                    entryType, entryId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LegacyBridgeUnavailableException unavailable) {
                LOG.debug("Legacy bridge unavailable: entry_type={}, entry_id={}, detail={}",
                        entryType, entryId, unavailable.detail());
                return Optional.empty();
            }
            if (cause instanceof HealingException healing && healing.kind() == HealingException.Kind.LEGACY_BRIDGE_ERROR) {
                throw healing.withCoordinates(entryType, entryId);
            }
            throw new LegacyBridgeException("Legacy bridge call failed: " + cause, cause, entryType, entryId);
        }
    }

    /** Builder for {@link HealingContext}. */
    public static final class Builder {

        private final EntryTypeProvider provider;
        private final String entryId;
        private byte[] currentBytes;
        private LegacyBridge legacyBridge;
        private int maxAttempts = 3;
        private Duration bridgeTimeout = Duration.ofSeconds(2);
        private Executor ioExecutor;

        Builder(EntryTypeProvider provider, String entryId) {
            this.provider = provider;
            this.entryId = entryId;
        }

        public Builder currentBytes(byte[] currentBytes) {
            this.currentBytes = currentBytes;
            return this;
        }

        public Builder legacyBridge(LegacyBridge legacyBridge) {
            this.legacyBridge = legacyBridge;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder bridgeTimeout(Duration bridgeTimeout) {
            this.bridgeTimeout = bridgeTimeout;
            return this;
        }

        public Builder ioExecutor(Executor ioExecutor) {
            this.ioExecutor = ioExecutor;
            return this;
        }

        public HealingContext build() {
            return new HealingContext(this);
        }
    }
}
