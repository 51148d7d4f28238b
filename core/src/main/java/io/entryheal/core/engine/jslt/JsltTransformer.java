package io.entryheal.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.entryheal.core.error.TransformationFailedException;
import io.entryheal.core.spi.Transformer;
import java.util.Objects;

/**
 * {@link Transformer} backed by a Schibsted JSLT expression. The expression is compiled once;
 * the compiled form is immutable and safe to apply from any thread.
 *
 * <pre>{@code
 * Transformer t = JsltTransformer.compile("{\"id\": .id, \"title\": .name, * : .}");
 * }</pre>
 */
public final class JsltTransformer implements Transformer {

    /** Language identifier used in provider YAML {@code transform.lang}. */
    public static final String LANG = "jslt";

    private final String source;
    private final Expression expression;

    private JsltTransformer(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    /**
     * Compiles a JSLT expression.
     *
     * @param expression the JSLT source
     * @return the transformer
     * @throws IllegalArgumentException if the expression does not compile
     */
    public static JsltTransformer compile(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        try {
            return new JsltTransformer(expression, Parser.compileString(expression));
        } catch (JsltException e) {
            throw new IllegalArgumentException("Failed to compile JSLT expression: " + e.getMessage(), e);
        }
    }

    @Override
    public JsonNode transform(JsonNode legacy) {
        try {
            return expression.apply(legacy);
        } catch (JsltException e) {
            throw new TransformationFailedException("JSLT evaluation failed: " + e.getMessage(), e);
        }
    }

    /** The JSLT source this transformer was compiled from. */
    public String source() {
        return source;
    }

    @Override
    public String description() {
        return "jslt(" + abbreviate(source) + ")";
    }

    private static String abbreviate(String text) {
        String oneLine = text.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= 60 ? oneLine : oneLine.substring(0, 57) + "...";
    }
}
