package io.formgen.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.formgen.core.error.InvalidPathException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.ErrorIndex;
import io.formgen.core.model.FormMode;
import io.formgen.core.model.FormState;
import io.formgen.core.model.MoveDirection;
import io.formgen.core.model.RenderDecision;
import io.formgen.core.model.SubmitResult;
import io.formgen.core.model.ValidationIssue;
import io.formgen.core.model.ValidationTrigger;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ArraySchema;
import io.formgen.core.spi.FormStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one form: seeds its document, applies field edits through {@link PathAccessor}, runs the
 * external validator and keeps the resulting {@link ErrorIndex} in the {@link FormStore}.
 *
 * <p>
 * Every mutation replaces the stored snapshot. In {@link FormMode#READONLY} mutations are rejected.
 * With {@link ValidationTrigger#ON_CHANGE} each mutation re-validates; with
 * {@link ValidationTrigger#ON_SUBMIT} errors change only on {@link #validate()} or
 * {@link #submit()}.
 *
 * <p>
 * Not thread-safe; drive it from the thread that owns the form.
 */
public final class FormController {

    private static final Logger LOG = LoggerFactory.getLogger(FormController.class);

    private final FormConfig config;
    private final FormStore store;
    private final DefaultDataGenerator generator;
    private final RenderDispatcher dispatcher;

    /** Creates a controller backed by an {@link InMemoryFormStore}. */
    public FormController(FormConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.generator = new DefaultDataGenerator(config.diagnostics());
        this.dispatcher = new RenderDispatcher(config.diagnostics());
        this.store = new InMemoryFormStore(initialState());
    }

    /** Creates a controller over a caller-supplied store; the store is seeded immediately. */
    public FormController(FormConfig config, FormStore store) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.generator = new DefaultDataGenerator(config.diagnostics());
        this.dispatcher = new RenderDispatcher(config.diagnostics());
        initialize();
    }

    /**
     * Replaces the stored state with the initial data, or the synthesized default document when
     * no initial data was configured. Clears errors.
     */
    public void initialize() {
        store.write(initialState());
    }

    public FormState state() {
        return store.read();
    }

    public FormStore store() {
        return store;
    }

    public FormConfig config() {
        return config;
    }

    /** A copy of the current document. */
    public JsonNode document() {
        return JsonNodeUtils.copyOf(store.read().document());
    }

    public JsonNode valueAt(DocumentPath path) {
        return PathAccessor.get(store.read().document(), path);
    }

    public void setValue(DocumentPath path, JsonNode value) {
        requireEditable("setValue");
        commit(PathAccessor.set(store.read().document(), path, value));
    }

    public void removeValue(DocumentPath path) {
        requireEditable("removeValue");
        commit(PathAccessor.remove(store.read().document(), path));
    }

    /**
     * Appends a new element to the array at {@code arrayPath}, seeded with the default of the
     * array's element schema.
     *
     * @throws InvalidPathException if no array schema governs {@code arrayPath}
     */
    public void addItem(DocumentPath arrayPath) {
        requireEditable("addItem");
        SchemaNode declared = schemaAt(arrayPath)
                .orElseThrow(() -> new InvalidPathException("No schema governs " + arrayPath, arrayPath.toString()));
        SchemaNode concrete = SchemaUnwrapper.unwrap(declared);
        if (!(concrete instanceof ArraySchema array)) {
            throw new InvalidPathException(
                    "Schema at " + arrayPath + " is " + concrete.kind() + ", not an array", arrayPath.toString());
        }
        addItem(arrayPath, () -> generator.generateDefault(array.element()));
    }

    public void addItem(DocumentPath arrayPath, Supplier<JsonNode> factory) {
        requireEditable("addItem");
        commit(PathAccessor.addItem(store.read().document(), arrayPath, factory));
    }

    public void removeItem(DocumentPath arrayPath, int index) {
        requireEditable("removeItem");
        commit(PathAccessor.removeItem(store.read().document(), arrayPath, index));
    }

    public void moveItem(DocumentPath arrayPath, int index, MoveDirection direction) {
        requireEditable("moveItem");
        commit(PathAccessor.moveItem(store.read().document(), arrayPath, index, direction));
    }

    /** Issues filed under {@code path} by the last validation pass. */
    public List<ValidationIssue> errorsAt(DocumentPath path) {
        return ErrorIndexer.lookup(store.read().errors(), path);
    }

    public boolean isRequired(DocumentPath path) {
        return RequirednessResolver.isRequiredAt(config.schema(), path);
    }

    public Optional<SchemaNode> schemaAt(DocumentPath path) {
        return SchemaNavigator.schemaAt(config.schema(), path);
    }

    /** Render decision for the field at {@code path}; unsupported when no schema governs it. */
    public RenderDecision decide(DocumentPath path) {
        return schemaAt(path)
                .map(node -> dispatcher.decide(node, path))
                .orElseGet(() -> RenderDecision.unsupported(null, "No schema governs " + path));
    }

    /** Runs the validator and stores the resulting error index. */
    public ErrorIndex validate() {
        ErrorIndex errors = ErrorIndexer.index(runValidator(store.read().document()));
        store.write(store.read().withErrors(errors));
        return errors;
    }

    /** Validates, stores the errors and reports the outcome with a copy of the document. */
    public SubmitResult submit() {
        JsonNode document = store.read().document();
        List<ValidationIssue> issues = runValidator(document);
        store.write(store.read().withErrors(ErrorIndexer.index(issues)));
        LOG.info("Form submitted: valid={}, issues={}", issues.isEmpty(), issues.size());
        return issues.isEmpty()
                ? SubmitResult.valid(JsonNodeUtils.copyOf(document))
                : SubmitResult.invalid(JsonNodeUtils.copyOf(document), issues);
    }

    public boolean isReadonly() {
        return config.mode() == FormMode.READONLY;
    }

    private FormState initialState() {
        JsonNode document = config.hasInitialData()
                ? config.initialData().deepCopy()
                : generator.generateDefault(config.schema());
        LOG.debug("Form initialized from {}", config.hasInitialData() ? "initial data" : "schema defaults");
        return new FormState(config.schema(), document, ErrorIndex.EMPTY, config.mode());
    }

    private void commit(JsonNode document) {
        FormState next = store.read().withDocument(document);
        if (config.trigger() == ValidationTrigger.ON_CHANGE) {
            next = next.withErrors(ErrorIndexer.index(runValidator(document)));
        }
        store.write(next);
    }

    private List<ValidationIssue> runValidator(JsonNode document) {
        if (config.validator() == null) {
            return List.of();
        }
        List<ValidationIssue> issues = config.validator().validate(document);
        return issues == null ? List.of() : issues;
    }

    private void requireEditable(String operation) {
        if (isReadonly()) {
            throw new IllegalStateException("Cannot " + operation + ": form is read-only");
        }
    }
}
