package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.frontend.lexer.TokenType;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.List;

/**
 * An AST node for the arithmetic operators {@code + - * /}.
 * <p>
 * String handling looks at the operand <em>nodes</em>, not at the evaluated values:
 * only a {@link StringLiteralNode} operand turns {@code +} into concatenation. A variable
 * that holds text is coerced to a number like any other operand.
 *
 * @param operator One of {@link TokenType#PLUS}, {@link TokenType#MINUS},
 *                 {@link TokenType#STAR}, {@link TokenType#SLASH}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOpNode(
        TokenType operator,
        Expression left,
        Expression right
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        boolean leftIsString = left instanceof StringLiteralNode;
        boolean rightIsString = right instanceof StringLiteralNode;

        if (leftIsString || rightIsString) {
            if (operator != TokenType.PLUS) {
                throw new InterpreterException(InterpreterErrorCode.TYPE_MISMATCH,
                        "Operator '" + symbol() + "' cannot be applied to a string.");
            }
            if (leftIsString && rightIsString) {
                return Value.of(((StringLiteralNode) left).text() + ((StringLiteralNode) right).text());
            }
            String leftText = left.evaluate(store).toText();
            String rightText = right.evaluate(store).toText();
            return Value.of(leftText + rightText);
        }

        double leftNumber = left.evaluate(store).toNumber();
        double rightNumber = right.evaluate(store).toNumber();
        // Division by zero yields Infinity or NaN.
        return Value.of(switch (operator) {
            case PLUS -> leftNumber + rightNumber;
            case MINUS -> leftNumber - rightNumber;
            case STAR -> leftNumber * rightNumber;
            case SLASH -> leftNumber / rightNumber;
            default -> throw new InterpreterException(InterpreterErrorCode.UNSUPPORTED_OPERATOR,
                    "Unexpected arithmetic operator: " + operator);
        });
    }

    private String symbol() {
        return switch (operator) {
            case MINUS -> "-";
            case STAR -> "*";
            case SLASH -> "/";
            default -> operator.name();
        };
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
