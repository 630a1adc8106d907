package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

/**
 * An AST node that represents a numeric literal.
 *
 * @param text The numeric text as written in the source, including a leading sign.
 * @param number The parsed number.
 */
public record NumberLiteralNode(
        String text,
        double number
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        return Value.of(number);
    }

    // This node has no children and inherits the empty list from getChildren().
}
