package org.quill.interpreter.frontend.parser;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;
import org.quill.interpreter.frontend.lexer.Lexer;
import org.quill.interpreter.frontend.lexer.Token;
import org.quill.interpreter.frontend.lexer.TokenType;
import org.quill.interpreter.frontend.parser.ast.*;

/**
 * A recursive-descent parser for one source line. It pulls tokens from a {@link Lexer}
 * and produces an Abstract Syntax Tree (AST).
 * <p>
 * Precedence, from lowest to highest binding:
 * <pre>
 * expression    := logicalTerm ( "or" logicalTerm )*
 * logicalTerm   := logicalFactor ( "and" logicalFactor )*
 * logicalFactor := "!" comparison | comparison
 * comparison    := relation ( ( "==" | "!=" ) expression )*
 * relation      := arithmetic ( ( "&lt;" | "&gt;" ) arithmetic )*
 * arithmetic    := term ( ( "+" | "-" ) term )*
 * term          := factor ( ( "*" | "/" ) factor )*
 * factor        := ( "+" | "-" ) factor | primary
 * primary       := NUMBER | "true" | "false" | STRING | "(" expression ")" | IDENTIFIER
 * </pre>
 * The right operand of {@code ==} and {@code !=} is a full {@code expression}, so
 * {@code a == b and c} parses as {@code a == (b and c)}.
 * <p>
 * Every parenthesis, prefix sign and binary operator nests the tree one level deeper.
 * Beyond {@link #MAX_NESTING_DEPTH} levels the line is rejected with
 * {@link InterpreterErrorCode#NESTING_TOO_DEEP}.
 * <p>
 * There is no error recovery: the first grammar violation throws an {@link InterpreterException}.
 */
public class Parser {

    /** Deepest expression tree a single line may produce. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final Lexer lexer;
    private int depth;

    /**
     * Constructs a new Parser.
     * @param lexer The lexer positioned at the first token of the line.
     */
    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Parses {@code name = expression;} or {@code print expression;}.
     * The lexer is left just past the terminating semicolon.
     * @return The parsed {@link Statement}.
     */
    public Statement parseStatement() {
        Statement statement;
        Token first = peek();
        switch (first.type()) {
            case IDENTIFIER -> {
                advance();
                if (!match(TokenType.ASSIGN)) {
                    throw error(InterpreterErrorCode.MISSING_ASSIGNMENT_OPERATOR,
                            "Expected '=' after '" + first.text() + "' in assignment statement, but got " + peek().describe() + ".");
                }
                statement = new AssignmentNode(first.text(), parseExpression());
            }
            case PRINT -> {
                advance();
                statement = new PrintNode(parseExpression());
            }
            default -> throw error(InterpreterErrorCode.UNRECOGNIZED_STATEMENT,
                    "Expected assignment or print statement, but got " + first.describe() + ".");
        }
        consume(TokenType.SEMICOLON, InterpreterErrorCode.MISSING_TERMINATOR, "Expected ';' after statement");
        return statement;
    }

    /**
     * Parses an expression. No terminating semicolon is required; the lexer is left on
     * the first token that does not belong to the expression.
     * @return The parsed {@link Expression}.
     */
    public Expression parseExpression() {
        Expression left = logicalTerm();
        int levels = 0;
        while (match(TokenType.OR)) {
            enterNesting();
            levels++;
            left = new LogicalOpNode(TokenType.OR, left, logicalTerm());
        }
        depth -= levels;
        return left;
    }

    /**
     * Verifies that nothing but an optional semicolon remains on the line.
     * @param allowTerminator Whether a single trailing {@code ;} is accepted.
     */
    public void expectEndOfLine(boolean allowTerminator) {
        if (allowTerminator) {
            match(TokenType.SEMICOLON);
        }
        if (!check(TokenType.END_OF_INPUT)) {
            throw error(InterpreterErrorCode.TRAILING_INPUT,
                    "Unexpected " + peek().describe() + " after end of " + (allowTerminator ? "expression." : "statement."));
        }
    }

    private Expression logicalTerm() {
        Expression left = logicalFactor();
        int levels = 0;
        while (match(TokenType.AND)) {
            enterNesting();
            levels++;
            left = new LogicalOpNode(TokenType.AND, left, logicalFactor());
        }
        depth -= levels;
        return left;
    }

    private Expression logicalFactor() {
        if (match(TokenType.NOT)) {
            enterNesting();
            Expression operand = comparison();
            depth--;
            return LogicalOpNode.not(operand);
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = relation();
        int levels = 0;
        while (check(TokenType.EQUAL_EQUAL) || check(TokenType.BANG_EQUAL)) {
            TokenType operator = advance().type();
            enterNesting();
            levels++;
            // Right operand is a full expression, see class comment.
            left = new ComparisonOpNode(operator, left, parseExpression());
        }
        depth -= levels;
        return left;
    }

    private Expression relation() {
        Expression left = arithmetic();
        int levels = 0;
        while (check(TokenType.LESS) || check(TokenType.GREATER)) {
            TokenType operator = advance().type();
            enterNesting();
            levels++;
            left = new ComparisonOpNode(operator, left, arithmetic());
        }
        depth -= levels;
        return left;
    }

    private Expression arithmetic() {
        Expression left = term();
        int levels = 0;
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType operator = advance().type();
            enterNesting();
            levels++;
            left = new BinaryOpNode(operator, left, term());
        }
        depth -= levels;
        return left;
    }

    private Expression term() {
        Expression left = factor();
        int levels = 0;
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            TokenType operator = advance().type();
            enterNesting();
            levels++;
            left = new BinaryOpNode(operator, left, factor());
        }
        depth -= levels;
        return left;
    }

    private Expression factor() {
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType operator = advance().type();
            enterNesting();
            Expression operand = factor();
            depth--;
            return new UnaryOpNode(operator, operand);
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return numberLiteral(token);
            }
            case TRUE, FALSE -> {
                advance();
                return new BooleanLiteralNode((Boolean) token.value());
            }
            case STRING -> {
                advance();
                return new StringLiteralNode((String) token.value());
            }
            case IDENTIFIER -> {
                advance();
                return new VariableNode(token.text());
            }
            case LEFT_PAREN -> {
                enterNesting();
                advance();
                Expression inner = parseExpression();
                consume(TokenType.RIGHT_PAREN, InterpreterErrorCode.MISMATCHED_PARENTHESES, "Mismatched parentheses: expected ')'");
                depth--;
                return inner;
            }
            default -> throw error(InterpreterErrorCode.UNEXPECTED_TOKEN,
                    "Syntax error: unexpected " + token.describe() + ".");
        }
    }

    private NumberLiteralNode numberLiteral(Token token) {
        String text = (String) token.value();
        try {
            return new NumberLiteralNode(text, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new InterpreterException(InterpreterErrorCode.INVALID_NUMBER_FORMAT,
                    "Invalid number format: " + text, token.column());
        }
    }

    private void enterNesting() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw error(InterpreterErrorCode.NESTING_TOO_DEEP,
                    "Expression is nested more than " + MAX_NESTING_DEPTH + " levels deep.");
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void consume(TokenType type, InterpreterErrorCode code, String message) {
        if (check(type)) {
            advance();
            return;
        }
        throw error(code, message + ", but got " + peek().describe() + ".");
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token consumed = lexer.current();
        lexer.advance();
        return consumed;
    }

    private Token peek() {
        return lexer.current();
    }

    private InterpreterException error(InterpreterErrorCode code, String message) {
        return new InterpreterException(code, message, peek().column());
    }
}
