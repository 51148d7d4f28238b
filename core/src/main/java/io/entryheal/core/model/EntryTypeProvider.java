package io.entryheal.core.model;

import io.entryheal.core.spi.DegradationHandler;
import io.entryheal.core.spi.ReferenceResolver;
import io.entryheal.core.spi.Transformer;
import io.entryheal.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the engine needs to heal one entry type: exactly one of each of the four contracts,
 * the reference fields of the current schema, and the schema/status tagging fields.
 *
 * <p>Immutable and thread-safe; built once at startup and shared by all concurrent calls. Use
 * {@link #builder(String)} to construct instances.
 */
public final class EntryTypeProvider {

    /** Default field holding the schema version. */
    public static final String DEFAULT_SCHEMA_VERSION_FIELD = "schema_version";

    /** Default field holding the validation status label. */
    public static final String DEFAULT_STATUS_FIELD = "validation_status";

    /** Default current schema version. */
    public static final int DEFAULT_SCHEMA_VERSION = 2;

    private final String entryType;
    private final Validator validator;
    private final Transformer transformer;
    private final ReferenceResolver referenceResolver;
    private final DegradationHandler degradationHandler;
    private final List<ReferenceField> references;
    private final int currentSchemaVersion;
    private final String schemaVersionField;
    private final String statusField;
    private final String description;

    private EntryTypeProvider(Builder b) {
        this.entryType = b.entryType;
        this.validator = Objects.requireNonNull(b.validator, "validator must not be null");
        this.transformer = Objects.requireNonNull(b.transformer, "transformer must not be null");
        this.referenceResolver = Objects.requireNonNull(b.referenceResolver, "referenceResolver must not be null");
        this.degradationHandler =
                Objects.requireNonNull(b.degradationHandler, "degradationHandler must not be null for " + entryType);
        this.references = List.copyOf(b.references);
        this.currentSchemaVersion = b.currentSchemaVersion;
        this.schemaVersionField = b.schemaVersionField;
        this.statusField = b.statusField;
        this.description = b.description;
    }

    /**
     * Returns a builder for the given entry type. The reference resolver defaults to
     * {@link ReferenceResolver#acceptAll()}; the degradation handler has no default and must be
     * set.
     */
    public static Builder builder(String entryType) {
        return new Builder(entryType);
    }

    public String entryType() {
        return entryType;
    }

    public Validator validator() {
        return validator;
    }

    public Transformer transformer() {
        return transformer;
    }

    public ReferenceResolver referenceResolver() {
        return referenceResolver;
    }

    public DegradationHandler degradationHandler() {
        return degradationHandler;
    }

    /** Reference fields of the current schema, in declaration order. */
    public List<ReferenceField> references() {
        return references;
    }

    public int currentSchemaVersion() {
        return currentSchemaVersion;
    }

    public String schemaVersionField() {
        return schemaVersionField;
    }

    /** The field receiving the status label of migrated and degraded entries, or {@code null}. */
    public String statusField() {
        return statusField;
    }

    /** Free-text description of the entry type, or {@code null}. */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return "EntryTypeProvider[" + entryType + ", v" + currentSchemaVersion + ", references=" + references.size()
                + "]";
    }

    /** Builder for {@link EntryTypeProvider}. */
    public static final class Builder {

        private final String entryType;
        private Validator validator;
        private Transformer transformer;
        private ReferenceResolver referenceResolver = ReferenceResolver.acceptAll();
        private DegradationHandler degradationHandler;
        private final List<ReferenceField> references = new ArrayList<>();
        private int currentSchemaVersion = DEFAULT_SCHEMA_VERSION;
        private String schemaVersionField = DEFAULT_SCHEMA_VERSION_FIELD;
        private String statusField = DEFAULT_STATUS_FIELD;
        private String description;

        Builder(String entryType) {
            if (entryType == null || entryType.isBlank()) {
                throw new IllegalArgumentException("entryType must not be null or blank");
            }
            this.entryType = entryType;
        }

        public Builder validator(Validator validator) {
            this.validator = validator;
            return this;
        }

        public Builder transformer(Transformer transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder referenceResolver(ReferenceResolver referenceResolver) {
            this.referenceResolver = referenceResolver;
            return this;
        }

        public Builder degradationHandler(DegradationHandler degradationHandler) {
            this.degradationHandler = degradationHandler;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Declares a reference field; order is kept. */
        public Builder reference(ReferenceField reference) {
            this.references.add(Objects.requireNonNull(reference, "reference must not be null"));
            return this;
        }

        public Builder currentSchemaVersion(int version) {
            if (version <= 0) {
                throw new IllegalArgumentException("currentSchemaVersion must be positive, got: " + version);
            }
            this.currentSchemaVersion = version;
            return this;
        }

        public Builder schemaVersionField(String field) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("schemaVersionField must not be null or blank");
            }
            this.schemaVersionField = field;
            return this;
        }

        /** Sets the status field; {@code null} disables status stamping. */
        public Builder statusField(String field) {
            this.statusField = field == null || field.isBlank() ? null : field;
            return this;
        }

        public EntryTypeProvider build() {
            return new EntryTypeProvider(this);
        }
    }
}
