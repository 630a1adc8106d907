package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

/**
 * An AST node that represents a string literal.
 * {@link BinaryOpNode} checks for this node type to decide on string concatenation.
 *
 * @param text The content between the quotes.
 */
public record StringLiteralNode(
        String text
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        return Value.of(text);
    }
}
