package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

/**
 * An AST node that reads a variable.
 *
 * @param name The variable name.
 */
public record VariableNode(
        String name
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        return store.get(name);
    }
}
