package io.imagexform.core.spi;

import io.imagexform.core.model.Operation;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit registry of the operations an engine understands, keyed by operation name. Macros and
 * primitives live in separate namespaces; a name registered in both resolves to the macro.
 *
 * <p>
 * This table is the engine's allow-list: names that are not registered are never forwarded to
 * the engine, whatever the engine object might otherwise respond to. Thread-safe; registration
 * and lookup can happen concurrently.
 *
 * @param <A> the engine's accumulator type
 */
public final class OperationTable<A> {

    private final Map<String, Macro<A>> macros = new ConcurrentHashMap<>();
    private final Map<String, Primitive<A>> primitives = new ConcurrentHashMap<>();

    /**
     * Registers a macro. Re-registering a name replaces the previous entry.
     *
     * @throws NullPointerException if name or macro is null
     * @throws IllegalArgumentException if name is empty or reserved
     */
    public OperationTable<A> registerMacro(String name, Macro<A> macro) {
        checkName(name);
        if (macro == null) {
            throw new NullPointerException("macro must not be null");
        }
        macros.put(name, macro);
        return this;
    }

    /**
     * Registers a pass-through primitive. Re-registering a name replaces the previous entry.
     *
     * @throws NullPointerException if name or primitive is null
     * @throws IllegalArgumentException if name is empty or reserved
     */
    public OperationTable<A> registerPrimitive(String name, Primitive<A> primitive) {
        checkName(name);
        if (primitive == null) {
            throw new NullPointerException("primitive must not be null");
        }
        primitives.put(name, primitive);
        return this;
    }

    /** Looks up a macro by name. */
    public Optional<Macro<A>> macro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    /** Looks up a primitive by name. */
    public Optional<Primitive<A>> primitive(String name) {
        return Optional.ofNullable(primitives.get(name));
    }

    /** Returns {@code true} if a macro is registered under the given name. */
    public boolean hasMacro(String name) {
        return macros.containsKey(name);
    }

    /** Returns {@code true} if a primitive is registered under the given name. */
    public boolean hasPrimitive(String name) {
        return primitives.containsKey(name);
    }

    /** All registered names, sorted. */
    public Set<String> names() {
        Set<String> names = new TreeSet<>(macros.keySet());
        names.addAll(primitives.keySet());
        return names;
    }

    private static void checkName(String name) {
        if (name == null) {
            throw new NullPointerException("operation name must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("operation name must not be empty");
        }
        if (Operation.CUSTOM.equals(name)) {
            throw new IllegalArgumentException("'" + Operation.CUSTOM + "' is reserved and cannot be registered");
        }
    }
}
