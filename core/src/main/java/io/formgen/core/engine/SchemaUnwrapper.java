package io.formgen.core.engine;

import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.schema.SchemaKind;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.WrapperChain;

/**
 * Strips wrapper layers (optional, nullable, default, prefault, readonly, non-optional and lazy
 * references) to reach the first concrete node.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class SchemaUnwrapper {

    private SchemaUnwrapper() {}

    /**
     * Returns the first non-wrapper node in {@code node}'s chain; a concrete node is returned as is.
     * Idempotent: {@code unwrap(unwrap(n)) == unwrap(n)}.
     *
     * @throws UnresolvableReferenceException if a lazy reference fails, resolves to nothing, or the
     *                                        chain cycles through the same reference
     */
    public static SchemaNode unwrap(SchemaNode node) {
        return WrapperChain.walk(node, SchemaKind.WRAPPERS);
    }
}
