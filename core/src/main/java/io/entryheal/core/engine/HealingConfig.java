package io.entryheal.core.engine;

import io.entryheal.core.spi.LegacyBridge;
import io.entryheal.core.strategy.HealingStrategies;
import io.entryheal.core.strategy.HealingStrategy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Orchestrator configuration. Use {@link #builder()}; every option has a default.
 *
 * <p>Immutable and thread-safe.
 *
 * @param legacyBridge read path into the prior schema version, or {@code null} where cross-version
 *     calls are forbidden
 * @param strategy the healing strategy (default: bridge-first)
 * @param allowDegradation whether DEGRADE decisions are honoured; when {@code false} they fail the
 *     call (default: true)
 * @param maxAttempts attempt budget per call across bridge and local repair (default: 3)
 * @param emitSignals whether {@code HealingListener} events are delivered (default: true)
 * @param bridgeTimeout bound on one legacy-bridge call (default: 2s)
 * @param referenceTimeout bound on the reference checks of one call (default: 1s)
 * @param ioExecutor executor for bridge and reference calls, or {@code null} to let the
 *     orchestrator create and own one. It must run tasks on other threads: an executor that runs
 *     them inline cannot enforce the timeouts
 */
public record HealingConfig(
        LegacyBridge legacyBridge,
        HealingStrategy strategy,
        boolean allowDegradation,
        int maxAttempts,
        boolean emitSignals,
        Duration bridgeTimeout,
        Duration referenceTimeout,
        Executor ioExecutor) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BRIDGE_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_REFERENCE_TIMEOUT = Duration.ofSeconds(1);

    public HealingConfig {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(bridgeTimeout, "bridgeTimeout must not be null");
        Objects.requireNonNull(referenceTimeout, "referenceTimeout must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        if (bridgeTimeout.isNegative() || bridgeTimeout.isZero()) {
            throw new IllegalArgumentException("bridgeTimeout must be positive, got: " + bridgeTimeout);
        }
        if (referenceTimeout.isNegative() || referenceTimeout.isZero()) {
            throw new IllegalArgumentException("referenceTimeout must be positive, got: " + referenceTimeout);
        }
    }

    /** Defaults: bridge-first, no bridge, degradation allowed, 3 attempts, signals on. */
    public static HealingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .legacyBridge(legacyBridge)
                .strategy(strategy)
                .allowDegradation(allowDegradation)
                .maxAttempts(maxAttempts)
                .emitSignals(emitSignals)
                .bridgeTimeout(bridgeTimeout)
                .referenceTimeout(referenceTimeout)
                .ioExecutor(ioExecutor);
    }

    /** Builder for {@link HealingConfig}. */
    public static final class Builder {

        private LegacyBridge legacyBridge;
        private HealingStrategy strategy = HealingStrategies.BRIDGE_FIRST;
        private boolean allowDegradation = true;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private boolean emitSignals = true;
        private Duration bridgeTimeout = DEFAULT_BRIDGE_TIMEOUT;
        private Duration referenceTimeout = DEFAULT_REFERENCE_TIMEOUT;
        private Executor ioExecutor;

        Builder() {}

        public Builder legacyBridge(LegacyBridge legacyBridge) {
            this.legacyBridge = legacyBridge;
            return this;
        }

        public Builder strategy(HealingStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /** Sets the strategy by configuration name, e.g. {@code self-repair-first}. */
        public Builder strategy(String strategyName) {
            this.strategy = HealingStrategies.byName(strategyName);
            return this;
        }

        public Builder allowDegradation(boolean allowDegradation) {
            this.allowDegradation = allowDegradation;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder emitSignals(boolean emitSignals) {
            this.emitSignals = emitSignals;
            return this;
        }

        public Builder bridgeTimeout(Duration bridgeTimeout) {
            this.bridgeTimeout = bridgeTimeout;
            return this;
        }

        public Builder referenceTimeout(Duration referenceTimeout) {
            this.referenceTimeout = referenceTimeout;
            return this;
        }

        /** Sets the I/O executor; it must run tasks asynchronously for timeouts to apply. */
        public Builder ioExecutor(Executor ioExecutor) {
            this.ioExecutor = ioExecutor;
            return this;
        }

        public HealingConfig build() {
            return new HealingConfig(
                    legacyBridge,
                    strategy,
                    allowDegradation,
                    maxAttempts,
                    emitSignals,
                    bridgeTimeout,
                    referenceTimeout,
                    ioExecutor);
        }
    }
}
