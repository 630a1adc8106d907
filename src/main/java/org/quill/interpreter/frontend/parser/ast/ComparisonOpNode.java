package org.quill.interpreter.frontend.parser.ast;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.frontend.lexer.TokenType;
import org.quill.interpreter.runtime.Value;
import org.quill.interpreter.runtime.VariableStore;

import java.util.List;

/**
 * An AST node for {@code == != < >}.
 * Unlike {@link BinaryOpNode}, text is recognized by the evaluated value: two texts may be
 * tested for (in)equality, text against anything else is a type error, and all other values
 * are compared as numbers (booleans as 1/0).
 *
 * @param operator One of {@link TokenType#EQUAL_EQUAL}, {@link TokenType#BANG_EQUAL},
 *                 {@link TokenType#LESS}, {@link TokenType#GREATER}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record ComparisonOpNode(
        TokenType operator,
        Expression left,
        Expression right
) implements Expression {

    @Override
    public Value evaluate(VariableStore store) {
        Value leftValue = left.evaluate(store);
        Value rightValue = right.evaluate(store);

        if (leftValue.isText() && rightValue.isText()) {
            String leftText = leftValue.toText();
            String rightText = rightValue.toText();
            return switch (operator) {
                case EQUAL_EQUAL -> Value.of(leftText.equals(rightText));
                case BANG_EQUAL -> Value.of(!leftText.equals(rightText));
                default -> throw new InterpreterException(InterpreterErrorCode.UNSUPPORTED_OPERATOR,
                        "Operator '" + symbol() + "' is not supported for strings.");
            };
        }
        if (leftValue.isText() || rightValue.isText()) {
            throw new InterpreterException(InterpreterErrorCode.TYPE_MISMATCH,
                    "Cannot compare a string with a non-string value.");
        }

        double leftNumber = leftValue.toNumber();
        double rightNumber = rightValue.toNumber();
        return switch (operator) {
            case EQUAL_EQUAL -> Value.of(leftNumber == rightNumber);
            case BANG_EQUAL -> Value.of(leftNumber != rightNumber);
            case LESS -> Value.of(leftNumber < rightNumber);
            case GREATER -> Value.of(leftNumber > rightNumber);
            default -> throw new InterpreterException(InterpreterErrorCode.UNSUPPORTED_OPERATOR,
                    "Unexpected comparison operator: " + operator);
        };
    }

    private String symbol() {
        return switch (operator) {
            case EQUAL_EQUAL -> "==";
            case BANG_EQUAL -> "!=";
            case LESS -> "<";
            case GREATER -> ">";
            default -> operator.name();
        };
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
