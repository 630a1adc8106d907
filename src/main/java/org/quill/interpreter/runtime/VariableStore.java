package org.quill.interpreter.runtime;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * The mutable mapping from variable name to value shared by all lines of one session.
 * It is passed explicitly into every evaluation call. Entries are only ever added or
 * overwritten, never removed. Not thread-safe.
 */
public class VariableStore {

    private final Map<String, Value> variables = new HashMap<>();

    /**
     * Looks up a variable.
     * @param name The variable name.
     * @return The bound value.
     * @throws InterpreterException with {@link InterpreterErrorCode#UNDEFINED_VARIABLE} if the name is unbound.
     */
    public Value get(String name) {
        Value value = variables.get(name);
        if (value == null) {
            throw new InterpreterException(InterpreterErrorCode.UNDEFINED_VARIABLE,
                    "Variable '" + name + "' is not defined.");
        }
        return value;
    }

    /**
     * Binds a variable, inserting it or overwriting the previous value.
     * @param name The variable name.
     * @param value The new value.
     */
    public void set(String name, Value value) {
        variables.put(name, value);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }

    /**
     * Returns a read-only copy of all bindings, sorted by name.
     * @return An unmodifiable snapshot.
     */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(variables));
    }
}
