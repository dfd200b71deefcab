package io.imagexform.core.spi;

import io.imagexform.core.model.OperationArgs;

/**
 * An engine-native operation forwarded verbatim. If the returned value is an instance of the
 * engine's accumulator type it becomes the new accumulator; anything else (a width query, for
 * instance) is treated as an inspection and the accumulator is kept.
 *
 * @param <A> the engine's accumulator type
 */
@FunctionalInterface
public interface Primitive<A> {

    Object invoke(A accumulator, OperationArgs args);
}
