package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.frontend.lexer.TokenType;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.List;

/**
 * An AST node for {@code and}, {@code or} and prefix negation {@code !}.
 * Both operands of {@code and}/{@code or} are always evaluated.
 *
 * @param operator One of {@link TokenType#AND}, {@link TokenType#OR}, {@link TokenType#NOT}.
 * @param left The operand of {@code not}, or the left operand.
 * @param right The right operand; {@code null} for {@code not}.
 */
public record LogicalOpNode(
        TokenType operator,
        Expression left,
        Expression right
) implements Expression {

    /**
     * Creates a {@code not} node.
     * @param operand The negated operand.
     * @return The node.
     */
    public static LogicalOpNode not(Expression operand) {
        return new LogicalOpNode(TokenType.NOT, operand, null);
    }

    @Override
    public Value evaluate(VariableStore store) {
        if (operator == TokenType.NOT) {
            return Value.of(!left.evaluate(store).toBoolean());
        }

        boolean leftValue = left.evaluate(store).toBoolean();
        boolean rightValue = right.evaluate(store).toBoolean();
        return switch (operator) {
            case AND -> Value.of(leftValue && rightValue);
            case OR -> Value.of(leftValue || rightValue);
            default -> throw new InterpreterException(InterpreterErrorCode.UNSUPPORTED_OPERATOR,
                    "Unexpected logical operator: " + operator);
        };
    }

    @Override
    public List<AstNode> getChildren() {
        return right == null ? List.of(left) : List.of(left, right);
    }
}
