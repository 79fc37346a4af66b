package io.formgen.core.engine;

import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.DocumentPath.Segment;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ArraySchema;
import io.formgen.core.schema.SchemaNode.ObjectSchema;
import io.formgen.core.schema.SchemaNode.TupleSchema;
import io.formgen.core.schema.SchemaNode.UnionSchema;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the schema node that governs a document path. Each step unwraps the current node, then
 * descends: object fields by name, array elements by any index, tuple slots by position. A union
 * descends into the first option that can host the segment.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class SchemaNavigator {

    /**
     * Result of descending one segment.
     *
     * @param host   the concrete container the last segment was resolved against
     * @param schema the (still wrapped) schema declared for that slot
     */
    public record Location(SchemaNode host, SchemaNode schema) {
        public Location {
            Objects.requireNonNull(host, "host must not be null");
            Objects.requireNonNull(schema, "schema must not be null");
        }
    }

    private SchemaNavigator() {}

    /**
     * Returns the declared schema at {@code path}, or empty when no schema governs it. The root
     * path yields {@code root} itself.
     *
     * @throws UnresolvableReferenceException if a lazy reference on the way fails to resolve
     */
    public static Optional<SchemaNode> schemaAt(SchemaNode root, DocumentPath path) {
        Objects.requireNonNull(root, "root must not be null");
        if (path.isRoot()) {
            return Optional.of(root);
        }
        return locate(root, path).map(Location::schema);
    }

    /** Like {@link #schemaAt} but also reports the container hosting the last segment. */
    public static Optional<Location> locate(SchemaNode root, DocumentPath path) {
        Objects.requireNonNull(root, "root must not be null");
        if (path.isRoot()) {
            return Optional.empty();
        }
        SchemaNode current = root;
        Location location = null;
        for (Segment segment : path.segments()) {
            Optional<Location> next = step(current, segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            location = next.get();
            current = location.schema();
        }
        return Optional.ofNullable(location);
    }

    /** The raw member name a segment addresses in an object. */
    static String key(Segment segment) {
        if (segment instanceof Segment.Field field) {
            return field.name();
        }
        return Integer.toString(((Segment.Index) segment).index());
    }

    /** The position a segment addresses in an array, or -1 for a field name that is not a canonical decimal. */
    static int index(Segment segment) {
        if (segment instanceof Segment.Index idx) {
            return idx.index();
        }
        String name = ((Segment.Field) segment).name();
        if (name.isEmpty() || name.length() > 9 || (name.length() > 1 && name.charAt(0) == '0')) {
            return -1;
        }
        for (int i = 0; i < name.length(); i++) {
            if (name.charAt(i) < '0' || name.charAt(i) > '9') {
                return -1;
            }
        }
        return Integer.parseInt(name);
    }

    private static Optional<Location> step(SchemaNode node, Segment segment) {
        SchemaNode concrete = SchemaUnwrapper.unwrap(node);
        if (concrete instanceof ObjectSchema object) {
            SchemaNode field = object.properties().get(key(segment));
            return field == null ? Optional.empty() : Optional.of(new Location(object, field));
        }
        if (concrete instanceof ArraySchema array) {
            return index(segment) < 0 ? Optional.empty() : Optional.of(new Location(array, array.element()));
        }
        if (concrete instanceof TupleSchema tuple) {
            int i = index(segment);
            return i < 0 || i >= tuple.items().size()
                    ? Optional.empty()
                    : Optional.of(new Location(tuple, tuple.items().get(i)));
        }
        if (concrete instanceof UnionSchema union) {
            for (SchemaNode option : union.options()) {
                Optional<Location> hosted = step(option, segment);
                if (hosted.isPresent()) {
                    return hosted;
                }
            }
        }
        return Optional.empty();
    }
}
