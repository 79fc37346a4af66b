package io.formgen.core.spi;

import io.formgen.core.model.FormState;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * SPI for the reactive container that holds a form's state. The engine only calls {@link #read()}
 * and {@link #write(FormState)}; notification of subscribers is entirely the store's business.
 */
public interface FormStore {

    /** Returns the current snapshot. */
    FormState read();

    /** Replaces the current snapshot. */
    void write(FormState state);

    /**
     * Registers a callback invoked with the selected slice whenever a write changes it.
     *
     * @param selector extracts the observed slice from a snapshot
     * @param callback receives the new slice
     * @return handle that removes the subscription
     */
    <T> Subscription subscribe(Function<FormState, T> selector, Consumer<? super T> callback);

    /** Handle for an active subscription. */
    @FunctionalInterface
    interface Subscription {
        void cancel();
    }
}
