package io.formgen.core.schema;

import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.schema.SchemaNode.LazySchema;
import io.formgen.core.schema.SchemaNode.Wrapper;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * The single "peel one layer" primitive shared by unwrapping, requiredness and default lookup. Each
 * of those walks the wrapper chain through a different set of kinds; keeping the peel itself here
 * means a new wrapper kind is handled once.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class WrapperChain {

    /** Layers that neither make a field optional nor stop the search for an optional wrapper. */
    private static final Set<SchemaKind> OPTIONAL_TRANSPARENT =
            Set.copyOf(EnumSet.of(SchemaKind.NULLABLE, SchemaKind.DEFAULT, SchemaKind.PREFAULT, SchemaKind.READONLY));

    private WrapperChain() {}

    /**
     * Whether the first layer of {@code node} that is not nullable, default, prefault or readonly is
     * an optional wrapper.
     *
     * @throws UnresolvableReferenceException if a lazy reference on the walk fails
     */
    public static boolean declaresOptional(SchemaNode node) {
        return walk(node, OPTIONAL_TRANSPARENT).kind() == SchemaKind.OPTIONAL;
    }

    /**
     * Peels one wrapper layer. Lazy references are resolved by invoking their getter.
     *
     * @param node any schema node
     * @return the wrapped node, or {@code null} if {@code node} is not a wrapper
     * @throws UnresolvableReferenceException if a lazy getter fails or returns {@code null}
     */
    public static SchemaNode peel(SchemaNode node) {
        return switch (node.kind()) {
            case OPTIONAL, NULLABLE, DEFAULT, PREFAULT, READONLY, NON_OPTIONAL -> ((Wrapper) node).inner();
            case LAZY -> resolve((LazySchema) node);
            case STRING,
                    NUMBER,
                    INTEGER,
                    BOOLEAN,
                    BIG_INTEGER,
                    DATE,
                    NULL,
                    LITERAL,
                    ENUM,
                    ARRAY,
                    OBJECT,
                    TUPLE,
                    UNION,
                    OPAQUE -> null;
        };
    }

    /**
     * Walks the chain while the current node's kind is in {@code passThrough} and returns the first
     * node that stops the walk.
     *
     * @throws UnresolvableReferenceException if a lazy reference fails or the walk revisits one
     */
    public static SchemaNode walk(SchemaNode node, Set<SchemaKind> passThrough) {
        Set<LazySchema> resolving = null;
        SchemaNode current = node;
        while (passThrough.contains(current.kind())) {
            if (current instanceof LazySchema lazy) {
                if (resolving == null) {
                    resolving = Collections.newSetFromMap(new IdentityHashMap<>());
                }
                if (!resolving.add(lazy)) {
                    throw new UnresolvableReferenceException(
                            "Lazy reference " + lazy + " resolves back to itself without reaching a concrete schema",
                            null);
                }
            }
            current = peel(current);
        }
        return current;
    }

    /**
     * Invokes a lazy reference's getter once.
     *
     * @throws UnresolvableReferenceException if the getter throws or returns {@code null}
     */
    public static SchemaNode resolve(LazySchema lazy) {
        SchemaNode resolved;
        try {
            resolved = lazy.getter().get();
        } catch (UnresolvableReferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnresolvableReferenceException("Lazy reference " + lazy + " failed to resolve", e, null);
        }
        if (resolved == null) {
            throw new UnresolvableReferenceException("Lazy reference " + lazy + " resolved to nothing", null);
        }
        return resolved;
    }
}
