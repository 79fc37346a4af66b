package io.formgen.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formgen.core.error.InvalidPathException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.DocumentPath.Segment;
import io.formgen.core.model.MoveDirection;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Immutable reads and writes of a JSON document by {@link DocumentPath}. Every write returns a new
 * root; the input document and the supplied values are never aliased into the result.
 *
 * <p>
 * Conventions:
 * <ul>
 * <li>A missing member, an out-of-range index and JSON {@code null} on the way all read as absent
 * ({@code MissingNode})</li>
 * <li>Traversing through a string, number or boolean is an {@link InvalidPathException}</li>
 * <li>{@code set} creates missing containers: an array when the next segment is an index, an object
 * otherwise. Writing past the end of an array pads the gap with absent slots</li>
 * <li>Writing absent into an object member removes the member</li>
 * </ul>
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class PathAccessor {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PathAccessor() {}

    /** Reads the value at {@code path}; absent when any step is missing. Returns a copy. */
    public static JsonNode get(JsonNode document, DocumentPath path) {
        JsonNode current = document;
        for (int i = 0; i < path.size(); i++) {
            current = child(current, path, i);
            if (JsonNodeUtils.isAbsent(current)) {
                return JsonNodeUtils.absent();
            }
        }
        return JsonNodeUtils.copyOf(current);
    }

    /** Returns a copy of {@code document} with {@code value} stored at {@code path}. */
    public static JsonNode set(JsonNode document, DocumentPath path, JsonNode value) {
        if (path.isRoot()) {
            return JsonNodeUtils.copyOf(value);
        }
        JsonNode root = JsonNodeUtils.isEmptyValue(document) ? containerFor(path.segment(0)) : document.deepCopy();
        if (!root.isContainerNode()) {
            throw throughScalar(root, path, 0);
        }
        JsonNode current = root;
        for (int i = 0; i < path.size() - 1; i++) {
            JsonNode existing = child(current, path, i);
            if (JsonNodeUtils.isEmptyValue(existing)) {
                JsonNode created = containerFor(path.segment(i + 1));
                put(current, path, i, created);
                current = created;
            } else if (existing.isContainerNode()) {
                current = existing;
            } else {
                throw throughScalar(existing, path, i + 1);
            }
        }
        put(current, path, path.size() - 1, JsonNodeUtils.copyOf(value));
        return root;
    }

    /**
     * Returns a copy of {@code document} without the value at {@code path}. Removing an array slot
     * shifts the following elements down. Removing something that is not there is a no-op.
     */
    public static JsonNode remove(JsonNode document, DocumentPath path) {
        if (path.isRoot()) {
            return JsonNodeUtils.absent();
        }
        JsonNode root = JsonNodeUtils.copyOf(document);
        JsonNode parent = root;
        for (int i = 0; i < path.size() - 1; i++) {
            parent = child(parent, path, i);
            if (JsonNodeUtils.isEmptyValue(parent)) {
                return root;
            }
        }
        int last = path.size() - 1;
        if (parent instanceof ObjectNode object) {
            object.remove(SchemaNavigator.key(path.segment(last)));
        } else if (parent instanceof ArrayNode array) {
            int index = arrayIndex(path, last);
            if (index < array.size()) {
                array.remove(index);
            }
        } else if (!JsonNodeUtils.isEmptyValue(parent)) {
            throw throughScalar(parent, path, last);
        }
        return root;
    }

    /**
     * Appends {@code factory.get()} to the array at {@code arrayPath}, creating the array when it is
     * absent. A factory returning {@code null} appends an absent slot.
     */
    public static JsonNode addItem(JsonNode document, DocumentPath arrayPath, Supplier<JsonNode> factory) {
        JsonNode existing = get(document, arrayPath);
        ArrayNode array;
        if (JsonNodeUtils.isEmptyValue(existing)) {
            array = NODES.arrayNode();
        } else if (existing instanceof ArrayNode a) {
            array = a;
        } else {
            throw notAnArray(existing, arrayPath);
        }
        array.add(JsonNodeUtils.copyOf(factory.get()));
        return set(document, arrayPath, array);
    }

    /** Removes element {@code index} of the array at {@code arrayPath}. */
    public static JsonNode removeItem(JsonNode document, DocumentPath arrayPath, int index) {
        ArrayNode array = requireArray(document, arrayPath, index);
        array.remove(index);
        return set(document, arrayPath, array);
    }

    /**
     * Swaps element {@code index} with its neighbour in {@code direction}. Moving the first element
     * up or the last element down leaves the array unchanged.
     */
    public static JsonNode moveItem(JsonNode document, DocumentPath arrayPath, int index, MoveDirection direction) {
        ArrayNode array = requireArray(document, arrayPath, index);
        int target = direction == MoveDirection.UP ? index - 1 : index + 1;
        if (target < 0 || target >= array.size()) {
            return JsonNodeUtils.copyOf(document);
        }
        JsonNode moving = array.get(index);
        array.set(index, array.get(target));
        array.set(target, moving);
        return set(document, arrayPath, array);
    }

    private static ArrayNode requireArray(JsonNode document, DocumentPath arrayPath, int index) {
        JsonNode existing = get(document, arrayPath);
        if (!(existing instanceof ArrayNode array)) {
            throw notAnArray(existing, arrayPath);
        }
        if (index < 0 || index >= array.size()) {
            throw new InvalidPathException(
                    "Index " + index + " is out of range for array of size " + array.size() + " at " + arrayPath,
                    arrayPath.child(Math.max(index, 0)).toString());
        }
        return array;
    }

    // Reads one step. Absent and null containers yield absent.
    private static JsonNode child(JsonNode container, DocumentPath path, int position) {
        if (JsonNodeUtils.isEmptyValue(container)) {
            return JsonNodeUtils.absent();
        }
        if (container.isObject()) {
            return container.path(SchemaNavigator.key(path.segment(position)));
        }
        if (container.isArray()) {
            return container.path(arrayIndex(path, position));
        }
        throw throughScalar(container, path, position);
    }

    private static void put(JsonNode container, DocumentPath path, int position, JsonNode value) {
        if (container instanceof ObjectNode object) {
            String key = SchemaNavigator.key(path.segment(position));
            if (JsonNodeUtils.isAbsent(value)) {
                object.remove(key);
            } else {
                object.set(key, value);
            }
            return;
        }
        ArrayNode array = (ArrayNode) container;
        int index = arrayIndex(path, position);
        if (index < array.size()) {
            array.set(index, value);
            return;
        }
        while (array.size() < index) {
            array.add(JsonNodeUtils.absent());
        }
        array.add(value);
    }

    private static int arrayIndex(DocumentPath path, int position) {
        int index = SchemaNavigator.index(path.segment(position));
        if (index < 0) {
            throw new InvalidPathException(
                    "Field segment '" + path.segment(position).text() + "' cannot address an array element",
                    prefix(path, position + 1).toString());
        }
        return index;
    }

    private static JsonNode containerFor(Segment next) {
        return next instanceof Segment.Index ? NODES.arrayNode() : NODES.objectNode();
    }

    private static InvalidPathException throughScalar(JsonNode scalar, DocumentPath path, int position) {
        return new InvalidPathException(
                "Cannot traverse into " + scalar.getNodeType().name().toLowerCase(Locale.ROOT) + " value at "
                        + prefix(path, position),
                path.toString());
    }

    private static InvalidPathException notAnArray(JsonNode found, DocumentPath arrayPath) {
        String type = JsonNodeUtils.isAbsent(found) ? "absent" : found.getNodeType().name().toLowerCase(Locale.ROOT);
        return new InvalidPathException("Expected an array at " + arrayPath + " but found " + type, arrayPath.toString());
    }

    private static DocumentPath prefix(DocumentPath path, int length) {
        return DocumentPath.of(path.segments().subList(0, length));
    }
}
