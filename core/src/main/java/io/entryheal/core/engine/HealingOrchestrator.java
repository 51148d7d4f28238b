package io.entryheal.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.entryheal.core.error.DegradationPolicyFailException;
import io.entryheal.core.error.HealingCancelledException;
import io.entryheal.core.error.HealingException;
import io.entryheal.core.error.MissingReferenceException;
import io.entryheal.core.error.UnknownEntryTypeException;
import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.model.AttemptMetadata;
import io.entryheal.core.model.DegradationDecision;
import io.entryheal.core.model.EntryJson;
import io.entryheal.core.model.EntrySource;
import io.entryheal.core.model.EntryTypeProvider;
import io.entryheal.core.model.HealingOutcome;
import io.entryheal.core.model.MissingReference;
import io.entryheal.core.model.ReferenceField;
import io.entryheal.core.model.ValidationStatus;
import io.entryheal.core.registry.ProviderRegistry;
import io.entryheal.core.spi.HealingListener;
import io.entryheal.core.strategy.BoundedCall;
import io.entryheal.core.strategy.HealingCandidate;
import io.entryheal.core.strategy.HealingContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for read-time healing. Looks up the provider for an entry type, runs the configured
 * {@link io.entryheal.core.strategy.HealingStrategy}, applies the provider's degradation policy to
 * validation failures and missing references, and returns a {@link HealingOutcome}.
 *
 * <p>Result contract of {@link #healById}:
 *
 * <ul>
 *   <li>an outcome with status VALID, MIGRATED or DEGRADED when a usable entry was produced;
 *   <li>empty when no data exists anywhere (no legacy data and no local bytes);
 *   <li>a thrown {@link HealingException} for hard failures: unknown type, exhausted attempts,
 *       a FAIL decision, an untransformable legacy entry with nothing to fall back to, or a hard
 *       bridge error.
 * </ul>
 *
 * <p>The engine never writes the healed entry back; callers decide whether to persist it.
 *
 * <p>Thread-safe: the registry is frozen on construction and every call gets its own
 * {@link HealingContext}. Concurrent calls for the same id are not deduplicated.
 */
public final class HealingOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HealingOrchestrator.class);

    /** MDC key for the entry type of the call in progress. */
    static final String MDC_ENTRY_TYPE = "entryType";
    /** MDC key for the entry id of the call in progress. */
    static final String MDC_ENTRY_ID = "entryId";

    private final ProviderRegistry registry;
    private final HealingConfig config;
    private final HealingListener listener;
    private final Executor ioExecutor;
    private final ExecutorService ownedExecutor;
    private volatile boolean closed;

    /**
     * Creates an orchestrator without a listener.
     *
     * @param registry the provider registry; frozen by this constructor
     * @param config the configuration
     */
    public HealingOrchestrator(ProviderRegistry registry, HealingConfig config) {
        this(registry, config, null);
    }

    /**
     * Creates an orchestrator.
     *
     * @param registry the provider registry; frozen by this constructor
     * @param config the configuration
     * @param listener optional listener for healing events, may be null
     */
    public HealingOrchestrator(ProviderRegistry registry, HealingConfig config, HealingListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null").freeze();
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener; // nullable
        if (config.ioExecutor() != null) {
            this.ownedExecutor = null;
            this.ioExecutor = config.ioExecutor();
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(new IoThreadFactory());
            this.ioExecutor = ownedExecutor;
        }
        LOG.info(
                "Healing orchestrator ready: strategy={}, entry_types={}, legacy_bridge={}, allow_degradation={}, "
                        + "max_attempts={}",
                config.strategy().name(),
                registry.entryTypes(),
                config.legacyBridge() != null,
                config.allowDegradation(),
                config.maxAttempts());
    }

    /** Returns {@code true} if a provider is registered for the entry type. */
    public boolean supportsEntryType(String entryType) {
        return registry.contains(entryType);
    }

    /** Entry types this orchestrator can heal. */
    public Set<String> supportedEntryTypes() {
        return registry.entryTypes();
    }

    public HealingConfig config() {
        return config;
    }

    /**
     * Heals one entry.
     *
     * @param entryType the entry type
     * @param id the entry id
     * @param maybeCurrentBytes what the caller found in the current-schema store, or {@code null}
     * @return the outcome, or empty if no data exists in any source the strategy tries
     * @throws UnknownEntryTypeException if no provider is registered for the entry type
     * @throws HealingException for every other hard failure
     * @throws IllegalStateException if the orchestrator has been closed
     */
    public Optional<HealingOutcome> healById(String entryType, String id, byte[] maybeCurrentBytes) {
        Objects.requireNonNull(id, "id must not be null");
        if (closed) {
            throw new IllegalStateException("HealingOrchestrator is closed");
        }
        long startNanos = System.nanoTime();
        MDC.put(MDC_ENTRY_TYPE, String.valueOf(entryType));
        MDC.put(MDC_ENTRY_ID, id);
        HealingContext context = null;
        try {
            EntryTypeProvider provider =
                    registry.get(entryType).orElseThrow(() -> new UnknownEntryTypeException(entryType, id));
            context = HealingContext.builder(provider, id)
                    .currentBytes(maybeCurrentBytes)
                    .legacyBridge(config.legacyBridge())
                    .maxAttempts(config.maxAttempts())
                    .bridgeTimeout(config.bridgeTimeout())
                    .ioExecutor(ioExecutor)
                    .build();

            notifyStarted(entryType, id);
            Optional<HealingCandidate> candidate = config.strategy().heal(context);
            if (candidate.isEmpty()) {
                LOG.debug("healing.no_data entry_type={} entry_id={} attempts={}", entryType, id, context.attempts());
                return Optional.empty();
            }

            HealingOutcome outcome = finish(provider, context, candidate.get(), startNanos);
            long durationMs = outcome.metadata().elapsed().toMillis();
            LOG.info(
                    "healing.completed entry_type={} entry_id={} status={} source={} attempts={} duration_ms={}",
                    entryType,
                    id,
                    outcome.status().label(),
                    outcome.metadata().source(),
                    outcome.metadata().attempts(),
                    durationMs);
            notifyCompleted(entryType, id, outcome, durationMs);
            return Optional.of(outcome);
        } catch (HealingException e) {
            e.withCoordinates(entryType, id);
            int attempts = context != null ? context.attempts() : 0;
            long durationMs = elapsed(startNanos).toMillis();
            LOG.warn(
                    "healing.failed entry_type={} entry_id={} kind={} attempts={} duration_ms={} detail={}",
                    entryType,
                    id,
                    e.kind(),
                    attempts,
                    durationMs,
                    e.detail());
            notifyFailed(entryType, id, e, attempts, durationMs);
            throw e;
        } finally {
            MDC.remove(MDC_ENTRY_TYPE);
            MDC.remove(MDC_ENTRY_ID);
        }
    }

    /**
     * Rejects further calls and shuts down the I/O executor if this orchestrator created it. A
     * caller-supplied executor is left running.
     */
    @Override
    public void close() {
        closed = true;
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    // --- Outcome assembly ---

    private HealingOutcome finish(
            EntryTypeProvider provider, HealingContext context, HealingCandidate candidate, long startNanos) {
        String entryType = provider.entryType();
        String id = context.entryId();

        if (candidate.source() == EntrySource.PASSTHROUGH) {
            return HealingOutcome.of(
                    candidate.entry(),
                    candidate.bytes(),
                    ValidationStatus.VALID,
                    List.of(),
                    null,
                    metadata(candidate, context, startNanos));
        }

        ValidationStatus status;
        String reason = null;
        if (candidate.isValid()) {
            status = candidate.isLegacySourced() ? ValidationStatus.MIGRATED : ValidationStatus.VALID;
        } else {
            ValidationFailedException failure = candidate.validationFailure();
            if (!candidate.isStructured()) {
                throw failure;
            }
            DegradationDecision decision = orFail(
                    provider.degradationHandler().onValidationFailure(entryType, failure, candidate.isLegacySourced()),
                    entryType,
                    "onValidationFailure");
            LOG.debug("Validation failure decision: entry_type={}, entry_id={}, decision={}, reason={}",
                    entryType, id, decision, failure.reason());
            switch (decision) {
                case ACCEPT -> status = ValidationStatus.MIGRATED;
                case DEGRADE -> {
                    requireDegradationAllowed(entryType, id, "validation failure: " + failure.reason());
                    status = ValidationStatus.DEGRADED;
                    reason = failure.reason();
                }
                default -> throw failure;
            }
        }

        List<MissingReference> missing = checkReferences(provider, id, candidate.entry());
        if (!missing.isEmpty()) {
            status = ValidationStatus.DEGRADED;
            String summary = "missing references: " + missing.stream()
                    .map(m -> m.refType() + "/" + m.refId())
                    .toList();
            reason = reason == null ? summary : reason + "; " + summary;
        }

        byte[] bytes;
        JsonNode entry;
        if (status == ValidationStatus.VALID) {
            entry = candidate.entry();
            bytes = candidate.bytes();
        } else {
            entry = stampStatus(provider, candidate.entry(), status);
            bytes = EntryJson.toBytes(entry);
        }
        if (status == ValidationStatus.DEGRADED) {
            LOG.warn("healing.degraded entry_type={} entry_id={} reason={}", entryType, id, reason);
            notifyDegraded(entryType, id, reason);
        }
        return HealingOutcome.of(entry, bytes, status, missing, reason, metadata(candidate, context, startNanos));
    }

    /**
     * Resolves every declared reference of the entry concurrently, then applies the degradation
     * policy in declaration order once all checks are done.
     *
     * @return the references that were missing and degraded
     */
    private List<MissingReference> checkReferences(EntryTypeProvider provider, String id, JsonNode entry) {
        if (provider.references().isEmpty()) {
            return List.of();
        }
        String entryType = provider.entryType();

        List<MissingReference> declared = new ArrayList<>();
        for (ReferenceField field : provider.references()) {
            for (String refId : EntryJson.referencedIds(entry, field)) {
                declared.add(new MissingReference(field.field(), field.targetEntryType(), refId));
            }
        }
        if (declared.isEmpty()) {
            return List.of();
        }

        Map<String, BoundedCall<Boolean>> checks = new LinkedHashMap<>();
        for (MissingReference ref : declared) {
            checks.computeIfAbsent(refKey(ref), k -> BoundedCall.start(
                    ioExecutor, () -> provider.referenceResolver().exists(ref.refType(), ref.refId())));
        }

        long deadline = System.nanoTime() + config.referenceTimeout().toNanos();
        Map<String, Boolean> found = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, BoundedCall<Boolean>> check : checks.entrySet()) {
                found.put(check.getKey(), await(check.getValue(), deadline, entryType, id, check.getKey()));
            }
        } catch (InterruptedException e) {
            checks.values().forEach(BoundedCall::cancel);
            Thread.currentThread().interrupt();
            throw new HealingCancelledException("Healing cancelled while resolving references", e, entryType, id);
        }

        List<MissingReference> degraded = new ArrayList<>();
        MissingReferenceException firstFail = null;
        for (MissingReference ref : declared) {
            if (found.get(refKey(ref))) {
                continue;
            }
            DegradationDecision decision = orFail(
                    provider.degradationHandler().onMissingReference(entryType, ref.refType(), ref.refId()),
                    entryType,
                    "onMissingReference");
            LOG.debug("Missing reference decision: entry_type={}, entry_id={}, field={}, ref={}/{}, decision={}",
                    entryType, id, ref.field(), ref.refType(), ref.refId(), decision);
            switch (decision) {
                case ACCEPT -> {}
                case DEGRADE -> degraded.add(ref);
                default -> {
                    if (firstFail == null) {
                        firstFail = new MissingReferenceException(ref.field(), ref.refType(), ref.refId(), entryType, id);
                    }
                }
            }
        }
        if (firstFail != null) {
            throw firstFail;
        }
        if (!degraded.isEmpty()) {
            requireDegradationAllowed(entryType, id, "missing references " + degraded);
        }
        return degraded;
    }

    /** Waits for one reference check. Timeouts and resolver errors count as "not found". */
    private static boolean await(BoundedCall<Boolean> call, long deadline, String entryType, String id, String key)
            throws InterruptedException {
        try {
            return Boolean.TRUE.equals(call.await(deadline));
        } catch (TimeoutException e) {
            LOG.debug("Reference check timed out: entry_type={}, entry_id={}, ref={}", entryType, id, printable(key));
            return false;
        } catch (ExecutionException e) {
            LOG.debug("Reference check failed: entry_type={}, entry_id={}, ref={}, error={}",
                    entryType, id, printable(key), String.valueOf(e.getCause()));
            return false;
        }
    }

    /** A handler that returns no decision is read as {@link DegradationDecision#FAIL}. */
    private static DegradationDecision orFail(DegradationDecision decision, String entryType, String method) {
        if (decision == null) {
            LOG.warn("DegradationHandler.{} returned null: entry_type={}; treating as FAIL", method, entryType);
            return DegradationDecision.FAIL;
        }
        return decision;
    }

    private void requireDegradationAllowed(String entryType, String id, String what) {
        if (!config.allowDegradation()) {
            throw new DegradationPolicyFailException(
                    "Degradation is disabled; refusing to degrade on " + what, entryType, id);
        }
    }

    private static JsonNode stampStatus(EntryTypeProvider provider, JsonNode entry, ValidationStatus status) {
        if (provider.statusField() == null || !entry.isObject()) {
            return entry;
        }
        ObjectNode copy = ((ObjectNode) entry).deepCopy();
        copy.put(provider.statusField(), status.label());
        return copy;
    }

    private static AttemptMetadata metadata(HealingCandidate candidate, HealingContext context, long startNanos) {
        return new AttemptMetadata(
                candidate.source(), candidate.isLegacySourced(), context.attempts(), elapsed(startNanos));
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String refKey(MissingReference ref) {
        return ref.refType() + '\u0000' + ref.refId();
    }

    private static String printable(String key) {
        return key.replace('\u0000', '/');
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect the call.

    private void notifyStarted(String entryType, String id) {
        if (listener == null || !config.emitSignals()) return;
        try {
            listener.onHealingStarted(
                    new HealingListener.HealingStartedEvent(entryType, id, config.strategy().name()));
        } catch (Exception e) {
            LOG.warn("HealingListener.onHealingStarted failed", e);
        }
    }

    private void notifyCompleted(String entryType, String id, HealingOutcome outcome, long durationMs) {
        if (listener == null || !config.emitSignals()) return;
        try {
            listener.onHealingCompleted(new HealingListener.HealingCompletedEvent(
                    entryType,
                    id,
                    outcome.status(),
                    outcome.metadata().attempts(),
                    outcome.metadata().legacyBridgeUsed(),
                    durationMs));
        } catch (Exception e) {
            LOG.warn("HealingListener.onHealingCompleted failed", e);
        }
    }

    private void notifyFailed(String entryType, String id, HealingException error, int attempts, long durationMs) {
        if (listener == null || !config.emitSignals()) return;
        try {
            listener.onHealingFailed(new HealingListener.HealingFailedEvent(
                    entryType, id, error.kind(), attempts, durationMs, error.detail()));
        } catch (Exception e) {
            LOG.warn("HealingListener.onHealingFailed failed", e);
        }
    }

    private void notifyDegraded(String entryType, String id, String reason) {
        if (listener == null || !config.emitSignals()) return;
        try {
            listener.onDegradedEntry(new HealingListener.DegradedEntryEvent(entryType, id, reason));
        } catch (Exception e) {
            LOG.warn("HealingListener.onDegradedEntry failed", e);
        }
    }

    /** Daemon threads, so an abandoned orchestrator never keeps the JVM alive. */
    private static final class IoThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "entry-heal-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
