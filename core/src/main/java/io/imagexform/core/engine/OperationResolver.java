package io.imagexform.core.engine;

import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.error.UnknownOperationException;
import io.imagexform.core.model.Operation;
import io.imagexform.core.model.OperationArgs;
import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.core.spi.ImageCallback;
import io.imagexform.core.spi.Macro;
import io.imagexform.core.spi.OperationTable;
import io.imagexform.core.spi.Primitive;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies and applies pipeline operations against an engine's {@link OperationTable}.
 *
 * <ol>
 *   <li>{@code custom} always invokes the attached callback; it is never forwarded.
 *   <li>A name registered as a macro runs the macro.
 *   <li>A name registered as a primitive is forwarded as a pass-through. A result of the
 *       accumulator type replaces the accumulator; any other result is an inspection and the
 *       accumulator is kept.
 *   <li>Anything else fails with {@link UnknownOperationException}.
 * </ol>
 */
public final class OperationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(OperationResolver.class);

    private OperationResolver() {
        // utility class
    }

    /** How an operation name resolved. */
    public enum Kind {
        CUSTOM,
        MACRO,
        PASS_THROUGH
    }

    /**
     * Classifies an operation name for the given engine.
     *
     * @throws UnknownOperationException if the engine registers the name as neither macro nor
     *     primitive
     */
    public static Kind resolve(EngineAdapter<?> adapter, String name) {
        if (Operation.CUSTOM.equals(name)) {
            return Kind.CUSTOM;
        }
        OperationTable<?> table = adapter.operations();
        if (table.hasMacro(name)) {
            return Kind.MACRO;
        }
        if (table.hasPrimitive(name)) {
            return Kind.PASS_THROUGH;
        }
        throw new UnknownOperationException(
                "Operation '" + name + "' is neither a macro nor a primitive of engine '" + adapter.id() + "'",
                name,
                adapter.id(),
                Phase.TRANSFORM);
    }

    /** Applies one {@link Operation} to the accumulator and returns the next accumulator. */
    @SuppressWarnings("unchecked")
    public static <A> A apply(EngineAdapter<A> adapter, Operation operation, A accumulator) {
        return apply(
                adapter,
                operation.name(),
                accumulator,
                OperationArgs.of(operation),
                (ImageCallback<A>) operation.callback());
    }

    /** Applies a named operation to the accumulator and returns the next accumulator. */
    public static <A> A apply(
            EngineAdapter<A> adapter, String name, A accumulator, OperationArgs args, ImageCallback<A> callback) {
        switch (resolve(adapter, name)) {
            case CUSTOM:
                return applyCustom(accumulator, callback);
            case MACRO:
                Optional<Macro<A>> macro = adapter.operations().macro(name);
                return macro.orElseThrow().apply(accumulator, args, callback);
            case PASS_THROUGH:
            default:
                Primitive<A> primitive = adapter.operations().primitive(name).orElseThrow();
                Object result = primitive.invoke(accumulator, args);
                if (adapter.accumulatorType().isInstance(result)) {
                    return adapter.accumulatorType().cast(result);
                }
                LOG.debug("Pass-through '{}' returned {}, keeping accumulator", name, result);
                return accumulator;
        }
    }

    private static <A> A applyCustom(A accumulator, ImageCallback<A> callback) {
        if (callback == null) {
            return accumulator;
        }
        A result = callback.apply(accumulator);
        return result != null ? result : accumulator;
    }
}
