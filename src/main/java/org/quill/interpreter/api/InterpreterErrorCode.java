package org.quill.interpreter.api;

/**
 * Defines unique, testable error codes for all errors that can occur while interpreting a line.
 * This decouples the test logic from the error messages.
 */
public enum InterpreterErrorCode {
    // region Lexer Errors
    /** A character that starts no token. */
    UNEXPECTED_CHARACTER(ErrorKind.LEX),
    /** A string literal without its closing quote. */
    UNTERMINATED_STRING(ErrorKind.LEX),
    // endregion

    // region Parser Errors
    /** A token that cannot start or continue the current grammar rule. */
    UNEXPECTED_TOKEN(ErrorKind.PARSE),
    /** A statement that is not terminated by ';'. */
    MISSING_TERMINATOR(ErrorKind.PARSE),
    /** An identifier at the start of a statement that is not followed by '='. */
    MISSING_ASSIGNMENT_OPERATOR(ErrorKind.PARSE),
    /** A '(' without its matching ')'. */
    MISMATCHED_PARENTHESES(ErrorKind.PARSE),
    /** A line that starts with neither an identifier nor 'print'. */
    UNRECOGNIZED_STATEMENT(ErrorKind.PARSE),
    /** Numeric text that is not a valid number, e.g. "1.2.3". */
    INVALID_NUMBER_FORMAT(ErrorKind.PARSE),
    /** Tokens left over after a complete statement or expression. */
    TRAILING_INPUT(ErrorKind.PARSE),
    /** An expression whose tree would exceed the parser's nesting limit. */
    NESTING_TOO_DEEP(ErrorKind.PARSE),
    // endregion

    // region Evaluation Errors
    /** A variable was read before it was assigned. */
    UNDEFINED_VARIABLE(ErrorKind.EVAL),
    /** Text was combined with a non-text operand where that is not allowed. */
    TYPE_MISMATCH(ErrorKind.EVAL),
    /** The operator is not defined for the operand types. */
    UNSUPPORTED_OPERATOR(ErrorKind.EVAL),
    /** A value could not be converted to the number or boolean an operator needs. */
    INVALID_COERCION(ErrorKind.EVAL);
    // endregion

    private final ErrorKind kind;

    InterpreterErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    /**
     * @return The pipeline stage this error belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }
}
