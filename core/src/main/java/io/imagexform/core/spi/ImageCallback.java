package io.imagexform.core.spi;

/**
 * A caller-supplied function invoked directly on the current accumulator. Used by the reserved
 * {@code custom} operation and handed to macros that accept a block.
 *
 * @param <A> the engine's accumulator type
 */
@FunctionalInterface
public interface ImageCallback<A> {

    /**
     * Transforms the accumulator.
     *
     * @param accumulator the current in-flight image
     * @return the new accumulator, or {@code null} to keep the current one
     */
    A apply(A accumulator);
}
