package io.formgen.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Shared JSON node helpers for the "absent" convention: a form document represents a value that is
 * not there as {@link MissingNode}, distinct from JSON {@code null}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /** The absent value. */
    public static JsonNode absent() {
        return MissingNode.getInstance();
    }

    /**
     * Determines if a node is absent.
     *
     * <ul>
     * <li>{@code null}, {@code MissingNode} → absent</li>
     * <li>{@code NullNode} → present (an explicit JSON null)</li>
     * <li>Any other node → present</li>
     * </ul>
     */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    /** Returns {@code true} for absent nodes and JSON {@code null}: nothing to traverse into. */
    public static boolean isEmptyValue(JsonNode node) {
        return isAbsent(node) || node.isNull();
    }

    /** Deep copy that maps Java {@code null} to absent. */
    public static JsonNode copyOf(JsonNode node) {
        return node == null ? absent() : node.deepCopy();
    }
}
