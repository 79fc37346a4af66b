package io.formgen.core.engine;

import io.formgen.core.model.FormState;
import io.formgen.core.spi.FormStore;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link FormStore}: holds one snapshot and notifies a subscriber only when the slice it
 * selected changes by {@code equals}, so a field editor watching its own value is not woken by an
 * edit elsewhere. Jackson trees compare deeply, so selecting a sub-document works as expected.
 *
 * <p>
 * Meant to be driven from a single thread. Subscribers may cancel (or subscribe) from within a
 * callback. A failing callback is logged and does not stop the others.
 */
public final class InMemoryFormStore implements FormStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryFormStore.class);

    private final List<Selection<?>> selections = new CopyOnWriteArrayList<>();
    private FormState state;

    public InMemoryFormStore(FormState initial) {
        this.state = Objects.requireNonNull(initial, "initial state must not be null");
    }

    @Override
    public FormState read() {
        return state;
    }

    @Override
    public void write(FormState next) {
        this.state = Objects.requireNonNull(next, "state must not be null");
        for (Selection<?> selection : selections) {
            selection.update(next);
        }
    }

    @Override
    public <T> Subscription subscribe(Function<FormState, T> selector, Consumer<? super T> callback) {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        Selection<T> selection = new Selection<>(selector, callback, selector.apply(state));
        selections.add(selection);
        return () -> selections.remove(selection);
    }

    /** Number of active subscriptions. */
    public int subscriberCount() {
        return selections.size();
    }

    private static final class Selection<T> {
        private final Function<FormState, T> selector;
        private final Consumer<? super T> callback;
        private T last;

        Selection(Function<FormState, T> selector, Consumer<? super T> callback, T initial) {
            this.selector = selector;
            this.callback = callback;
            this.last = initial;
        }

        void update(FormState state) {
            T next = selector.apply(state);
            if (Objects.equals(last, next)) {
                return;
            }
            last = next;
            try {
                callback.accept(next);
            } catch (Exception e) {
                LOG.warn("Form store subscriber failed", e);
            }
        }
    }
}
