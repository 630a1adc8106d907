package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

/**
 * An AST node that represents {@code true} or {@code false}.
 *
 * @param value The literal value.
 */
public record BooleanLiteralNode(
        boolean value
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        return Value.of(value);
    }
}
