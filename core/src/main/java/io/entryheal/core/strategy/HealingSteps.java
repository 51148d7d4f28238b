package io.entryheal.core.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.entryheal.core.error.HealingException;
import io.entryheal.core.error.TransformationFailedException;
import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.model.EntryJson;
import io.entryheal.core.model.EntrySource;
import io.entryheal.core.model.EntryTypeProvider;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The building blocks strategies compose: local repair, the legacy-bridge path, and passthrough.
 * Stateless.
 */
final class HealingSteps {

    private static final Logger LOG = LoggerFactory.getLogger(HealingSteps.class);

    private HealingSteps() {}

    /**
     * Validates the caller's current-schema bytes as they are. Consumes one attempt when bytes
     * are present; absent bytes fall through without consuming one.
     *
     * @return a LOCAL candidate, or empty if there are no local bytes
     */
    static Optional<HealingCandidate> repairLocal(HealingContext ctx) {
        Optional<byte[]> local = ctx.currentBytes();
        if (local.isEmpty()) {
            LOG.debug("No local bytes: entry_type={}, entry_id={}", ctx.entryType(), ctx.entryId());
            return Optional.empty();
        }
        ctx.consumeAttempt();
        byte[] bytes = local.get();
        Optional<JsonNode> parsed = EntryJson.parse(bytes);
        if (parsed.isEmpty()) {
            return Optional.of(new HealingCandidate(
                    EntryJson.parseOrMissing(bytes),
                    bytes,
                    EntrySource.LOCAL,
                    new ValidationFailedException("Local entry is not valid JSON", ctx.entryType(), ctx.entryId())));
        }
        ValidationFailedException failure = validate(ctx, parsed.get());
        LOG.debug("Local repair: entry_type={}, entry_id={}, valid={}", ctx.entryType(), ctx.entryId(), failure == null);
        return Optional.of(new HealingCandidate(parsed.get(), bytes, EntrySource.LOCAL, failure));
    }

    /**
     * Fetches legacy data, transforms it, tags it current and validates it. Consumes one attempt
     * when a bridge is configured.
     *
     * @return a LEGACY_BRIDGE candidate, or empty if there is no bridge, no legacy data, or the
     *     prior version is unreachable
     * @throws TransformationFailedException if the legacy data cannot be transformed
     */
    static Optional<HealingCandidate> fromLegacyBridge(HealingContext ctx) {
        if (!ctx.hasLegacyBridge()) {
            return Optional.empty();
        }
        Optional<byte[]> legacyBytes = ctx.fetchLegacy();
        if (legacyBytes.isEmpty()) {
            LOG.debug("No legacy data: entry_type={}, entry_id={}", ctx.entryType(), ctx.entryId());
            return Optional.empty();
        }
        JsonNode legacy = EntryJson.parse(legacyBytes.get())
                .orElseThrow(() -> new TransformationFailedException(
                        "Legacy entry is not valid JSON", ctx.entryType(), ctx.entryId()));
        ObjectNode current = transform(ctx, legacy);
        ValidationFailedException failure = validate(ctx, current);
        LOG.debug("Legacy bridge: entry_type={}, entry_id={}, valid={}", ctx.entryType(), ctx.entryId(), failure == null);
        return Optional.of(new HealingCandidate(current, EntryJson.toBytes(current), EntrySource.LEGACY_BRIDGE, failure));
    }

    /** Hands the local bytes back without inspection. Consumes one attempt when bytes are present. */
    static Optional<HealingCandidate> passthrough(HealingContext ctx) {
        Optional<byte[]> local = ctx.currentBytes();
        if (local.isEmpty()) {
            return Optional.empty();
        }
        ctx.consumeAttempt();
        return Optional.of(new HealingCandidate(
                EntryJson.parseOrMissing(local.get()), local.get(), EntrySource.PASSTHROUGH, null));
    }

    private static ObjectNode transform(HealingContext ctx, JsonNode legacy) {
        EntryTypeProvider provider = ctx.provider();
        JsonNode output;
        try {
            output = provider.transformer().transform(legacy);
        } catch (HealingException e) {
            throw e.withCoordinates(ctx.entryType(), ctx.entryId());
        } catch (RuntimeException e) {
            throw new TransformationFailedException(
                    provider.transformer().description() + " failed: " + e.getMessage(), e, ctx.entryType(), ctx.entryId());
        }
        if (output == null || !output.isObject()) {
            throw new TransformationFailedException(
                    provider.transformer().description() + " did not produce a JSON object", ctx.entryType(), ctx.entryId());
        }
        ObjectNode stamped = ((ObjectNode) output).deepCopy();
        stamped.put(provider.schemaVersionField(), provider.currentSchemaVersion());
        return stamped;
    }

    private static ValidationFailedException validate(HealingContext ctx, JsonNode entry) {
        try {
            ctx.provider().validator().validate(entry);
            return null;
        } catch (ValidationFailedException e) {
            e.withCoordinates(ctx.entryType(), ctx.entryId());
            return e;
        } catch (HealingException e) {
            throw e.withCoordinates(ctx.entryType(), ctx.entryId());
        } catch (RuntimeException e) {
            return new ValidationFailedException("Validator failed: " + e.getMessage(), e, ctx.entryType(), ctx.entryId());
        }
    }
}
