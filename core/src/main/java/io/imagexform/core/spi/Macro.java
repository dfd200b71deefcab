package io.imagexform.core.spi;

import io.imagexform.core.model.OperationArgs;

/**
 * A named operation with engine-independent semantics (e.g. {@code resize_to_fill}). Each engine
 * implements the macro table for its own accumulator type; the output geometry of a macro is the
 * same regardless of which engine runs it.
 *
 * @param <A> the engine's accumulator type
 */
@FunctionalInterface
public interface Macro<A> {

    A apply(A accumulator, OperationArgs args, ImageCallback<A> callback);
}
