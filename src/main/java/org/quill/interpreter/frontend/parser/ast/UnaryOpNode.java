package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.frontend.lexer.TokenType;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.List;

/**
 * An AST node for prefix {@code +} and {@code -}.
 *
 * @param operator Either {@link TokenType#PLUS} or {@link TokenType#MINUS}.
 * @param operand The operand.
 */
public record UnaryOpNode(
        TokenType operator,
        Expression operand
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        double number = operand.evaluate(store).toNumber();
        return Value.of(operator == TokenType.MINUS ? -number : +number);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
