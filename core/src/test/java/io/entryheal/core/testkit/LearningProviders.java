package io.entryheal.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.entryheal.core.engine.DegradationPolicies;
import io.entryheal.core.error.TransformationFailedException;
import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.model.EntryJson;
import io.entryheal.core.model.EntryTypeProvider;
import io.entryheal.core.model.ReferenceField;
import io.entryheal.core.spi.ReferenceResolver;
import io.entryheal.core.spi.Transformer;
import io.entryheal.core.spi.Validator;
import java.util.List;

/**
 * Providers for a learning platform's entry types: content nodes, learning paths, path steps and
 * per-learner content mastery. Used as realistic fixtures across the test suite.
 */
public final class LearningProviders {

    public static final String CONTENT = "content";
    public static final String LEARNING_PATH = "learning_path";
    public static final String PATH_STEP = "path_step";
    public static final String CONTENT_MASTERY = "content_mastery";
    public static final String HUMAN = "human";

    public static final List<String> CONTENT_TYPES = List.of(
            "epic", "concept", "lesson", "scenario", "assessment", "resource", "practice", "reflection", "reference",
            "external");
    public static final List<String> REACH_LEVELS =
            List.of("private", "intimate", "trusted", "familiar", "community", "public", "commons");
    public static final List<String> MASTERY_LEVELS = List.of(
            "not_started", "seen", "remember", "understand", "apply", "analyze", "evaluate", "create");

    private LearningProviders() {}

    /** Content nodes; related nodes are checked through the resolver and degrade when missing. */
    public static EntryTypeProvider.Builder content(ReferenceResolver resolver) {
        return EntryTypeProvider.builder(CONTENT)
                .validator(new ContentValidator())
                .transformer(new ContentTransformer())
                .referenceResolver(resolver)
                .reference(ReferenceField.many("related_node_ids", CONTENT))
                .degradationHandler(DegradationPolicies.alwaysDegrade());
    }

    public static EntryTypeProvider.Builder learningPath() {
        return EntryTypeProvider.builder(LEARNING_PATH)
                .validator(LearningProviders::validateLearningPath)
                .transformer(new LearningPathTransformer())
                .degradationHandler(DegradationPolicies.alwaysDegrade());
    }

    public static EntryTypeProvider.Builder pathStep(ReferenceResolver resolver) {
        return EntryTypeProvider.builder(PATH_STEP)
                .validator(LearningProviders::validatePathStep)
                .transformer(new PathStepTransformer())
                .referenceResolver(resolver)
                .reference(ReferenceField.one("path_id", LEARNING_PATH))
                .reference(ReferenceField.one("content_id", CONTENT))
                .degradationHandler(DegradationPolicies.alwaysDegrade());
    }

    public static EntryTypeProvider.Builder contentMastery(ReferenceResolver resolver) {
        return EntryTypeProvider.builder(CONTENT_MASTERY)
                .validator(LearningProviders::validateContentMastery)
                .transformer(new ContentMasteryTransformer())
                .referenceResolver(resolver)
                .reference(ReferenceField.one("human_id", HUMAN))
                .reference(ReferenceField.one("content_id", CONTENT))
                .degradationHandler(DegradationPolicies.alwaysDegrade());
    }

    // --- Validators ---

    /** Content: id, title and a known content_type; optional reach; current schema version. */
    public static final class ContentValidator implements Validator {

        @Override
        public void validate(JsonNode entry) {
            requireText(entry, "id", "Content");
            requireText(entry, "title", "Content");
            String contentType = requireText(entry, "content_type", "Content");
            if (!CONTENT_TYPES.contains(contentType)) {
                throw new ValidationFailedException(
                        "Invalid content_type '" + contentType + "'. Must be one of: " + CONTENT_TYPES);
            }
            JsonNode reach = entry.path("reach");
            if (reach.isTextual() && !REACH_LEVELS.contains(reach.asText())) {
                throw new ValidationFailedException(
                        "Invalid reach '" + reach.asText() + "'. Must be one of: " + REACH_LEVELS);
            }
            requireSchemaVersion(entry);
            JsonNode related = entry.path("related_node_ids");
            for (int i = 0; i < related.size(); i++) {
                if (related.get(i).isTextual() && related.get(i).asText().isEmpty()) {
                    throw new ValidationFailedException("Related node ID at index " + i + " cannot be empty");
                }
            }
        }
    }

    static void validateLearningPath(JsonNode entry) {
        requireText(entry, "id", "Path");
        requireText(entry, "title", "Path");
        requireSchemaVersion(entry);
    }

    static void validatePathStep(JsonNode entry) {
        requireText(entry, "id", "Step");
        requireText(entry, "path_id", "Step");
        requireSchemaVersion(entry);
    }

    static void validateContentMastery(JsonNode entry) {
        requireText(entry, "id", "Mastery");
        requireText(entry, "human_id", "Mastery");
        requireText(entry, "content_id", "Mastery");
        String level = requireText(entry, "mastery_level", "Mastery");
        if (!MASTERY_LEVELS.contains(level)) {
            throw new ValidationFailedException(
                    "Invalid mastery_level '" + level + "'. Must be one of: " + MASTERY_LEVELS);
        }
        requireSchemaVersion(entry);
    }

    // --- Transformers (v1 -> v2) ---

    public static final class ContentTransformer implements Transformer {

        @Override
        public JsonNode transform(JsonNode v1) {
            ObjectNode v2 = EntryJson.mapper().createObjectNode();
            v2.put("id", legacyText(v1, "id", "Content"));
            v2.put("content_type", v1.path("content_type").asText("lesson"));
            v2.put("title", legacyText(v1, "title", "Content"));
            v2.put("description", v1.path("description").asText(""));
            v2.put("content", v1.path("content").asText(""));
            v2.put("content_format", v1.path("content_format").asText("markdown"));
            v2.set("tags", textArray(v1.path("tags")));
            v2.put("reach", v1.path("reach").asText("community"));
            v2.set("related_node_ids", textArray(v1.path("related_node_ids")));
            return v2;
        }

        @Override
        public String description() {
            return "content v1->v2";
        }
    }

    static final class LearningPathTransformer implements Transformer {

        @Override
        public JsonNode transform(JsonNode v1) {
            ObjectNode v2 = EntryJson.mapper().createObjectNode();
            v2.put("id", legacyText(v1, "id", "LearningPath"));
            v2.put("title", legacyText(v1, "title", "LearningPath"));
            v2.put("description", v1.path("description").asText(""));
            v2.put("difficulty", v1.path("difficulty").asText("intermediate"));
            v2.set("tags", textArray(v1.path("tags")));
            return v2;
        }
    }

    static final class PathStepTransformer implements Transformer {

        @Override
        public JsonNode transform(JsonNode v1) {
            ObjectNode v2 = EntryJson.mapper().createObjectNode();
            v2.put("id", legacyText(v1, "id", "PathStep"));
            v2.put("path_id", legacyText(v1, "path_id", "PathStep"));
            v2.put("content_id", v1.path("content_id").asText(""));
            v2.put("step_type", v1.path("step_type").asText("content"));
            v2.put("order", v1.path("order").asLong(0));
            return v2;
        }
    }

    static final class ContentMasteryTransformer implements Transformer {

        @Override
        public JsonNode transform(JsonNode v1) {
            ObjectNode v2 = EntryJson.mapper().createObjectNode();
            v2.put("id", legacyText(v1, "id", "ContentMastery"));
            v2.put("human_id", legacyText(v1, "human_id", "ContentMastery"));
            v2.put("content_id", legacyText(v1, "content_id", "ContentMastery"));
            v2.put("mastery_level", v1.path("mastery_level").asText("not_started"));
            v2.put("mastery_level_index", v1.path("mastery_level_index").asLong(0));
            v2.put("freshness_score", v1.path("freshness_score").asDouble(0.0));
            v2.put("engagement_count", v1.path("engagement_count").asLong(0));
            return v2;
        }
    }

    // --- helpers ---

    private static String requireText(JsonNode entry, String field, String label) {
        JsonNode value = entry.path(field);
        if (!value.isTextual()) {
            throw new ValidationFailedException(label + " " + field + " is required and must be string");
        }
        if (value.asText().isEmpty()) {
            throw new ValidationFailedException(label + " " + field + " cannot be empty");
        }
        return value.asText();
    }

    private static void requireSchemaVersion(JsonNode entry) {
        long version = entry.path("schema_version").asLong(0);
        if (version != 2) {
            throw new ValidationFailedException("Expected schema_version 2, got " + version);
        }
    }

    private static String legacyText(JsonNode v1, String field, String label) {
        JsonNode value = v1.path(field);
        if (!value.isTextual()) {
            throw new TransformationFailedException("v1 " + label + " missing " + field);
        }
        return value.asText();
    }

    private static ArrayNode textArray(JsonNode node) {
        ArrayNode out = EntryJson.mapper().createArrayNode();
        node.forEach(item -> {
            if (item.isTextual()) {
                out.add(item.asText());
            }
        });
        return out;
    }
}
