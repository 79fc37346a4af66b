package io.formgen.core.engine;

import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.error.UnsupportedSchemaKindException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.EditorVariant;
import io.formgen.core.model.RenderDecision;
import io.formgen.core.model.TemplateKind;
import io.formgen.core.schema.PresentationHint;
import io.formgen.core.schema.SchemaKind;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ArraySchema;
import io.formgen.core.schema.SchemaNode.BigIntegerSchema;
import io.formgen.core.schema.SchemaNode.DateSchema;
import io.formgen.core.schema.SchemaNode.LazySchema;
import io.formgen.core.schema.SchemaNode.NumberSchema;
import io.formgen.core.schema.SchemaNode.OpaqueSchema;
import io.formgen.core.schema.SchemaNode.StringSchema;
import io.formgen.core.schema.SchemaNode.UnionSchema;
import io.formgen.core.schema.WrapperChain;
import io.formgen.core.spi.DiagnosticListener;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a schema node to the template kind that renders it and the editor inside that template.
 *
 * <p>
 * Dispatch is on the unwrapped node. A union of exactly two options where exactly one is the null
 * kind is a nullable field in disguise and dispatches as its other option. Within a kind, an
 * explicit presentation hint wins over what the constraints suggest.
 *
 * <p>
 * Kinds with no editor (a lone literal or null, an opaque kind, a lazy reference that cannot be
 * resolved) come back as {@link TemplateKind#UNSUPPORTED} and are reported to the
 * {@link DiagnosticListener}; dispatch itself never fails.
 */
public final class RenderDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RenderDispatcher.class);

    private final DiagnosticListener listener;

    public RenderDispatcher() {
        this(DiagnosticListener.NONE);
    }

    public RenderDispatcher(DiagnosticListener listener) {
        this.listener = listener != null ? listener : DiagnosticListener.NONE;
    }

    /** Returns the template kind for {@code node}. */
    public TemplateKind dispatch(SchemaNode node) {
        return decide(node, DocumentPath.root()).kind();
    }

    public RenderDecision decide(SchemaNode node) {
        return decide(node, DocumentPath.root());
    }

    /**
     * Returns the full decision for {@code node}; {@code path} only labels diagnostics.
     */
    public RenderDecision decide(SchemaNode node, DocumentPath path) {
        return decide(node, path, null, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private RenderDecision decide(
            SchemaNode node, DocumentPath path, PresentationHint inherited, Set<UnionSchema> visiting) {
        SchemaNode concrete;
        try {
            concrete = SchemaUnwrapper.unwrap(node);
        } catch (UnresolvableReferenceException e) {
            UnresolvableReferenceException located =
                    new UnresolvableReferenceException(e.getMessage(), e, path.toString());
            Diagnostics.report(LOG, listener, path, located);
            return RenderDecision.unsupported(null, located.getMessage());
        }
        PresentationHint hint = inherited != null ? inherited : hintOf(node);
        LOG.debug("Dispatching {} at {} (hint={})", concrete.kind(), path, hint == null ? "none" : hint.kind());
        return switch (concrete.kind()) {
            case STRING -> RenderDecision.of(
                    TemplateKind.STRING, stringVariant((StringSchema) concrete, hint), concrete);
            case NUMBER, INTEGER -> RenderDecision.of(
                    TemplateKind.NUMBER,
                    rangeOr(hint, ((NumberSchema) concrete).isBounded(), EditorVariant.NUMBER_INPUT),
                    concrete);
            case BIG_INTEGER -> RenderDecision.of(
                    TemplateKind.BIG_INTEGER,
                    rangeOr(hint, ((BigIntegerSchema) concrete).isBounded(), EditorVariant.BIG_INTEGER_INPUT),
                    concrete);
            case DATE -> RenderDecision.of(TemplateKind.DATE, dateVariant((DateSchema) concrete, hint), concrete);
            case BOOLEAN -> RenderDecision.of(
                    TemplateKind.BOOLEAN, hinted(hint, "radio") ? EditorVariant.RADIO : EditorVariant.CHECKBOX, concrete);
            case ENUM -> RenderDecision.of(
                    TemplateKind.ENUM, hinted(hint, "radio") ? EditorVariant.RADIO : EditorVariant.SELECT, concrete);
            case ARRAY -> RenderDecision.of(TemplateKind.ARRAY, arrayVariant((ArraySchema) concrete, hint), concrete);
            case OBJECT -> RenderDecision.of(TemplateKind.OBJECT, EditorVariant.FIELDSET, concrete);
            case TUPLE -> RenderDecision.of(TemplateKind.TUPLE, EditorVariant.TUPLE, concrete);
            case UNION -> decideUnion((UnionSchema) concrete, hint, path, visiting);
            case NULL, LITERAL, OPAQUE -> unsupported(concrete, path);
            case OPTIONAL, NULLABLE, DEFAULT, PREFAULT, READONLY, NON_OPTIONAL, LAZY -> throw new IllegalStateException(
                    "Unwrapped node is still a wrapper: " + concrete.kind());
        };
    }

    private RenderDecision decideUnion(
            UnionSchema union, PresentationHint hint, DocumentPath path, Set<UnionSchema> visiting) {
        SchemaNode member = nullablePartner(union.options());
        if (member != null) {
            // a nullable member that resolves back to an enclosing union never reaches a concrete kind
            if (!visiting.add(union)) {
                UnresolvableReferenceException e = new UnresolvableReferenceException(
                        "Union at " + path + " refers back to itself through its nullable member", path.toString());
                Diagnostics.report(LOG, listener, path, e);
                return RenderDecision.unsupported(union, e.getMessage());
            }
            return decide(member, path, hint, visiting);
        }
        EditorVariant variant = !union.options().isEmpty() && allLiterals(union.options())
                ? EditorVariant.LITERAL_CHOICE
                : EditorVariant.COMPLEX_UNION;
        return RenderDecision.of(TemplateKind.UNION, variant, union);
    }

    private RenderDecision unsupported(SchemaNode concrete, DocumentPath path) {
        String kindName = concrete instanceof OpaqueSchema opaque
                ? opaque.typeName()
                : concrete.kind().name().toLowerCase(Locale.ROOT);
        UnsupportedSchemaKindException e = new UnsupportedSchemaKindException(kindName, path.toString());
        Diagnostics.report(LOG, listener, path, e);
        return RenderDecision.unsupported(concrete, e.getMessage());
    }

    private static EditorVariant stringVariant(StringSchema string, PresentationHint hint) {
        if (hinted(hint, "textarea")) {
            return EditorVariant.TEXTAREA;
        }
        String format = string.format() == null ? "" : string.format().toLowerCase(Locale.ROOT);
        return switch (format) {
            case "date" -> EditorVariant.DATE_INPUT;
            case "date-time", "datetime" -> EditorVariant.DATETIME_INPUT;
            case "email" -> EditorVariant.EMAIL_INPUT;
            case "url", "uri" -> EditorVariant.URL_INPUT;
            default -> EditorVariant.INPUT;
        };
    }

    private static EditorVariant rangeOr(PresentationHint hint, boolean bounded, EditorVariant plain) {
        if (hinted(hint, "range") && bounded) {
            return EditorVariant.RANGE;
        }
        if (hinted(hint, "input")) {
            return plain;
        }
        return bounded ? EditorVariant.RANGE : plain;
    }

    private static EditorVariant dateVariant(DateSchema date, PresentationHint hint) {
        if (hinted(hint, "range") && date.isBounded()) {
            return EditorVariant.RANGE;
        }
        if (hinted(hint, "datetime")) {
            return EditorVariant.DATETIME_INPUT;
        }
        if (hinted(hint, "input")) {
            return EditorVariant.DATE_INPUT;
        }
        return date.isBounded() ? EditorVariant.RANGE : EditorVariant.DATE_INPUT;
    }

    private static EditorVariant arrayVariant(ArraySchema array, PresentationHint hint) {
        boolean choices = isChoiceSet(array.element());
        if (choices && hinted(hint, "multiSelect")) {
            return EditorVariant.MULTI_SELECT;
        }
        if (choices && hinted(hint, "checkbox")) {
            return EditorVariant.CHECKBOX_GROUP;
        }
        if (hinted(hint, "list")) {
            return EditorVariant.LIST;
        }
        return choices ? EditorVariant.CHECKBOX_GROUP : EditorVariant.LIST;
    }

    private static boolean isChoiceSet(SchemaNode element) {
        SchemaNode concrete = unwrapQuietly(element);
        if (concrete == null) {
            return false;
        }
        if (concrete.kind() == SchemaKind.ENUM) {
            return true;
        }
        return concrete instanceof UnionSchema union && !union.options().isEmpty() && allLiterals(union.options());
    }

    private static boolean allLiterals(List<SchemaNode> options) {
        for (SchemaNode option : options) {
            SchemaNode concrete = unwrapQuietly(option);
            if (concrete == null || concrete.kind() != SchemaKind.LITERAL) {
                return false;
            }
        }
        return true;
    }

    // The non-null option of a two-option union with exactly one null option, else null.
    private static SchemaNode nullablePartner(List<SchemaNode> options) {
        if (options.size() != 2) {
            return null;
        }
        boolean firstNull = isNullKind(options.get(0));
        boolean secondNull = isNullKind(options.get(1));
        if (firstNull == secondNull) {
            return null;
        }
        return firstNull ? options.get(1) : options.get(0);
    }

    private static boolean isNullKind(SchemaNode option) {
        SchemaNode concrete = unwrapQuietly(option);
        return concrete != null && concrete.kind() == SchemaKind.NULL;
    }

    // Member checks treat an unresolvable member as "not that kind"; the member's own dispatch
    // reports it.
    private static SchemaNode unwrapQuietly(SchemaNode node) {
        try {
            return SchemaUnwrapper.unwrap(node);
        } catch (UnresolvableReferenceException e) {
            LOG.debug("Member does not resolve: {}", e.getMessage());
            return null;
        }
    }

    /** The hint of the outermost layer in {@code node}'s wrapper chain that declares one. */
    static PresentationHint hintOf(SchemaNode node) {
        Set<LazySchema> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        SchemaNode current = node;
        while (current != null) {
            if (current.metadata().hasHint()) {
                return current.metadata().hint();
            }
            if (!current.kind().isWrapper() || (current instanceof LazySchema lazy && !seen.add(lazy))) {
                return null;
            }
            current = WrapperChain.peel(current);
        }
        return null;
    }

    private static boolean hinted(PresentationHint hint, String editor) {
        return hint != null && hint.is(editor);
    }
}
