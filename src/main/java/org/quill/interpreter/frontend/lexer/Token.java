package org.quill.interpreter.frontend.lexer;

/**
 * Represents a single token extracted from a source line by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., NUMBER, IDENTIFIER, PLUS).
 * @param text The exact text of the token from the source line.
 * @param value The literal payload: the numeric text of a number, the content of a string,
 *              the {@link Boolean} of {@code true}/{@code false}, the name of an identifier.
 *              {@code null} for operators and punctuation.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int column
) {

    /**
     * Creates the end-of-input sentinel for the given column.
     * @param column The column just past the last character of the line.
     * @return The sentinel token.
     */
    public static Token endOfInput(int column) {
        return new Token(TokenType.END_OF_INPUT, "", null, column);
    }

    /**
     * Returns a short human-readable description of the token for error messages.
     * @return The token text, or "end of line" for the sentinel.
     */
    public String describe() {
        return type == TokenType.END_OF_INPUT ? "end of line" : "'" + text + "'";
    }
}
