package io.formgen.core.engine;

import io.formgen.core.error.SchemaException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ObjectSchema;
import io.formgen.core.schema.WrapperChain;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a field may be absent. One walk answers both predicates so they cannot drift:
 * the field is optional iff the first layer that is not nullable, default, prefault or readonly is
 * an optional wrapper.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class RequirednessResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RequirednessResolver.class);

    private RequirednessResolver() {}

    public static boolean isOptional(SchemaNode node) {
        return WrapperChain.declaresOptional(node);
    }

    public static boolean isRequired(SchemaNode node) {
        return !isOptional(node);
    }

    /**
     * Decides requiredness for the field at {@code path} under {@code root}, for required-marker
     * display. The root, array elements and tuple slots are always required; an object field is
     * required iff its object lists it as required and its own chain is not optional. A path no
     * schema governs is not required.
     */
    public static boolean isRequiredAt(SchemaNode root, DocumentPath path) {
        if (path.isRoot()) {
            return true;
        }
        Optional<SchemaNavigator.Location> location;
        try {
            location = SchemaNavigator.locate(root, path);
        } catch (SchemaException e) {
            LOG.debug("Cannot determine requiredness at {}: {}", path, e.getMessage());
            return false;
        }
        if (location.isEmpty()) {
            return false;
        }
        SchemaNavigator.Location loc = location.get();
        if (loc.host() instanceof ObjectSchema object) {
            String name = SchemaNavigator.key(path.lastSegment());
            return object.requiredNames().contains(name) && isRequired(loc.schema());
        }
        return true;
    }
}
