package org.quill.interpreter.frontend.lexer;

import org.quill.interpreter.api.InterpreterErrorCode;
import org.quill.interpreter.api.InterpreterException;

import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts one source line into a
 * sequence of tokens. It is pull-based: the parser inspects {@link #current()} and
 * requests the next token with {@link #advance()}. The lexer never re-reads text
 * it has already consumed.
 * <p>
 * Lexical errors are thrown as {@link InterpreterException}s and abort the line.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "and", TokenType.AND,
            "or", TokenType.OR,
            "print", TokenType.PRINT
    );

    private final String source;
    private int start = 0;
    private int current = 0;
    private Token currentToken;

    /**
     * Creates a new Lexer and scans the first token.
     * @param source A single line of source text.
     * @throws InterpreterException if the first token is malformed.
     */
    public Lexer(String source) {
        this.source = source;
        this.currentToken = scanToken();
    }

    /**
     * Returns the lookahead token without consuming it.
     * @return The current token. Never {@code null}.
     */
    public Token current() {
        return currentToken;
    }

    /**
     * Moves to the next token. Once the end of the line is reached, every further call
     * returns the end-of-input token again.
     * @return The new current token.
     * @throws InterpreterException if the next token is malformed.
     */
    public Token advance() {
        if (currentToken.type() != TokenType.END_OF_INPUT) {
            currentToken = scanToken();
        }
        return currentToken;
    }

    private Token scanToken() {
        skipWhitespace();
        start = current;
        if (isAtEnd()) {
            return Token.endOfInput(current + 1);
        }

        char c = advanceChar();
        switch (c) {
            case '"': return string();
            case '*': return makeToken(TokenType.STAR);
            case '/': return makeToken(TokenType.SLASH);
            case '(': return makeToken(TokenType.LEFT_PAREN);
            case ')': return makeToken(TokenType.RIGHT_PAREN);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '<': return makeToken(TokenType.LESS);
            case '>': return makeToken(TokenType.GREATER);
            case '&': return makeToken(TokenType.AND);
            case '|': return makeToken(TokenType.OR);
            case '+', '-':
                // A sign directly followed by a digit belongs to the numeric literal.
                if (isDigit(peek())) {
                    return number();
                }
                return makeToken(c == '+' ? TokenType.PLUS : TokenType.MINUS);
            case '!':
                return makeToken(match('=') ? TokenType.BANG_EQUAL : TokenType.NOT);
            case '=':
                return makeToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
            default:
                if (isDigit(c)) {
                    return number();
                }
                if (Character.isLetter(c)) {
                    return word();
                }
                throw new InterpreterException(InterpreterErrorCode.UNEXPECTED_CHARACTER,
                        "Unexpected character: " + c, start + 1);
        }
    }

    /**
     * Consumes digits and decimal points. The text is not validated here; a malformed
     * literal such as "1.2.3" is rejected when the parser converts it.
     */
    private Token number() {
        while (isDigit(peek()) || peek() == '.') advanceChar();
        String text = source.substring(start, current);
        return new Token(TokenType.NUMBER, text, text, start + 1);
    }

    private Token word() {
        while (Character.isLetterOrDigit(peek())) advanceChar();
        String text = source.substring(start, current);
        TokenType keyword = KEYWORDS.get(text);
        if (keyword == null) {
            return new Token(TokenType.IDENTIFIER, text, text, start + 1);
        }
        Object value = switch (keyword) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            default -> null;
        };
        return new Token(keyword, text, value, start + 1);
    }

    // No escape sequences: everything up to the next quote is taken verbatim.
    private Token string() {
        while (peek() != '"' && !isAtEnd()) advanceChar();

        if (isAtEnd()) {
            throw new InterpreterException(InterpreterErrorCode.UNTERMINATED_STRING,
                    "Unterminated string literal.", start + 1);
        }

        // The closing "
        advanceChar();

        String value = source.substring(start + 1, current - 1);
        return new Token(TokenType.STRING, source.substring(start, current), value, start + 1);
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), null, start + 1);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advanceChar();
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advanceChar() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
